package com.example.research_insights_backend.util;

import com.example.research_insights_backend.mapper.WorkMapper;
import com.example.research_insights_backend.model.Work;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 启动时从 works.json 导入文献语料（表中已有数据则跳过）
 */
@Slf4j
@Component
public class DataImporter implements CommandLineRunner {

    @Autowired
    private WorkMapper workMapper;

    @Value("${insights.import.resource:/works.json}")
    private String importResource;

    @Override
    public void run(String... args) throws Exception {
        // 检查是否已有数据
        if (workMapper.selectCount(null) > 0) {
            log.info("数据库中已有文献数据，跳过导入");
            return;
        }

        log.info("开始导入文献数据: {}", importResource);
        try (InputStream is = getClass().getResourceAsStream(importResource)) {
            if (is == null) {
                log.warn("未找到{}文件，跳过数据导入", importResource);
                return;
            }

            ObjectMapper mapper = new ObjectMapper();
            List<Map<String, Object>> rawData = mapper.readValue(is, new TypeReference<List<Map<String, Object>>>() {});

            int imported = 0;
            for (Map<String, Object> item : rawData) {
                workMapper.insert(toWork(item));
                imported++;
            }
            log.info("文献数据导入完成，共{}条，当前总数{}", imported, workMapper.selectCount(null));
        } catch (Exception e) {
            log.error("文献数据导入失败", e);
        }
    }

    /**
     * 把一条原始 JSON 记录转换为 Work；年份无法解析时置空，被引数缺失时为0
     */
    static Work toWork(Map<String, Object> item) {
        Work work = new Work();
        work.setWorkId(asString(item.get("workId")));
        work.setDoi(asString(item.get("doi")));
        work.setTitle(asString(item.get("title")));
        work.setVenue(asString(item.get("venue")));
        work.setYear(asInteger(item.get("year")));
        Integer citations = asInteger(item.get("citations"));
        work.setCitations(citations == null ? 0 : Math.max(0, citations));
        work.setTopicsList(asStringList(item.get("topics")));
        work.setAuthorIdList(asStringList(item.get("authorIds")));
        return work;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Integer asInteger(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                if (element != null && !element.toString().trim().isEmpty()) {
                    result.add(element.toString().trim());
                }
            }
        }
        return result;
    }
}
