package com.example.research_insights_backend.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 文献记录（work），包含年份、被引次数、主题标签及作者标识。
 */
@Data
@TableName("works")
public class Work {
    private static final String TOPIC_SEPARATOR = ";";
    private static final String AUTHOR_SEPARATOR = ",";

    @TableId(type = IdType.AUTO)
    private Long id;

    // 外部标识，可能带有 https://openalex.org/ 之类的前缀
    private String workId;

    private String doi;

    private String title;

    // 可为空，无年份的记录不参与任何时间窗口统计
    private Integer year;

    private Integer citations;

    private String venue;

    // 数据库中以分号拼接的主题字符串
    @JsonIgnore
    private String topics;

    // 数据库中以逗号拼接的作者标识字符串
    @JsonIgnore
    private String authorIds;

    @TableField(exist = false)
    private List<String> topicsList;

    @TableField(exist = false)
    private List<String> authorIdList;

    public List<String> getTopicsList() {
        if (topicsList == null) {
            topicsList = split(topics, TOPIC_SEPARATOR);
        }
        return topicsList;
    }

    public void setTopicsList(List<String> topicsList) {
        this.topicsList = topicsList;
        this.topics = topicsList == null ? null : String.join(TOPIC_SEPARATOR, topicsList);
    }

    public List<String> getAuthorIdList() {
        if (authorIdList == null) {
            authorIdList = split(authorIds, AUTHOR_SEPARATOR);
        }
        return authorIdList;
    }

    public void setAuthorIdList(List<String> authorIdList) {
        this.authorIdList = authorIdList;
        this.authorIds = authorIdList == null ? null : String.join(AUTHOR_SEPARATOR, authorIdList);
    }

    /**
     * 被引次数，缺失时按0处理
     */
    @JsonIgnore
    public long getCitationCount() {
        return citations == null ? 0L : Math.max(0, citations);
    }

    /**
     * 判断该文献是否包含指定作者（忽略大小写）
     */
    public boolean hasAuthor(String authorId) {
        if (authorId == null || authorId.trim().isEmpty()) {
            return false;
        }
        String target = authorId.trim();
        for (String candidate : getAuthorIdList()) {
            if (candidate.equalsIgnoreCase(target)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> split(String joined, String separator) {
        if (joined == null || joined.isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(joined.split(separator))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
