package com.example.research_insights_backend.util;

import com.example.research_insights_backend.mapper.WorkMapper;
import com.example.research_insights_backend.model.Work;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class DataImporterTest {

    @Mock
    private WorkMapper workMapper;

    @InjectMocks
    private DataImporter dataImporter;

    @Test
    public void testToWork() {
        Map<String, Object> item = new HashMap<>();
        item.put("workId", "https://openalex.org/W1");
        item.put("title", "T");
        item.put("year", "n.d.");
        item.put("topics", Arrays.asList("X", " ", "Y"));
        item.put("authorIds", Arrays.asList("A1", "A2"));

        Work work = DataImporter.toWork(item);

        assertEquals("https://openalex.org/W1", work.getWorkId());
        assertNull(work.getYear());
        assertEquals(Integer.valueOf(0), work.getCitations());
        assertEquals("X;Y", work.getTopics());
        assertEquals("A1,A2", work.getAuthorIds());

        item.put("year", " 2019 ");
        item.put("citations", 12);
        Work parsed = DataImporter.toWork(item);
        assertEquals(Integer.valueOf(2019), parsed.getYear());
        assertEquals(Integer.valueOf(12), parsed.getCitations());
    }

    @Test
    public void testImportsBundledCorpusIntoEmptyTable() throws Exception {
        ReflectionTestUtils.setField(dataImporter, "importResource", "/works.json");
        when(workMapper.selectCount(any())).thenReturn(0L, 7L);

        dataImporter.run();

        verify(workMapper, times(7)).insert(any(Work.class));
    }

    @Test
    public void testSkipsWhenTableHasData() throws Exception {
        when(workMapper.selectCount(any())).thenReturn(3L);

        dataImporter.run();

        verify(workMapper, never()).insert(any(Work.class));
    }
}
