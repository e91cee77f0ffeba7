package com.example.research_insights_backend.util;

import com.example.research_insights_backend.model.ExclusionEntry;
import com.example.research_insights_backend.model.ExclusionScope;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 屏蔽名单 CSV 解析测试
 */
public class DenyListCsvParserTest {

    @Test
    public void testParseSkipsHeaderCommentsAndShortRows() {
        String csv = "\uFEFF# comment\n"
                + "scope,authorId,workIdentifier,doi,titleSlug\r\n"
                + "\n"
                + "global,,W1,,\n"
                + "per-author,A1,,10.1/x,\n"
                + "global,,W2\n"
                + "whatever,A9,,,some-slug\n";

        DenyListCsvParser.Result result = DenyListCsvParser.parse(csv);
        List<ExclusionEntry> entries = result.getEntries();

        assertEquals(3, entries.size());
        assertEquals(1, result.getSkippedRows());

        assertEquals(ExclusionScope.GLOBAL, entries.get(0).getScope());
        assertEquals("W1", entries.get(0).getWorkIdentifier());
        assertNull(entries.get(0).getDoi());

        assertEquals(ExclusionScope.PER_AUTHOR, entries.get(1).getScope());
        assertEquals("A1", entries.get(1).getAuthorId());
        assertEquals("10.1/x", entries.get(1).getDoi());

        // 无法识别的 scope 按全局处理
        assertEquals(ExclusionScope.GLOBAL, entries.get(2).getScope());
        assertEquals("some-slug", entries.get(2).getTitleSlug());
    }

    @Test
    public void testQuotedFields() {
        assertEquals(Arrays.asList("global", "", "a,b", "say \"hi\"", "x\"y"),
                DenyListCsvParser.splitRow("global,,\"a,b\",\"say \"\"hi\"\"\",\"x\\\"y\""));
    }

    @Test
    public void testQuotedFieldMaySpanLines() {
        String csv = "scope,authorId,workIdentifier,doi,titleSlug\n"
                + "global,,,,\"graph\r\nbased \"\"learning\"\"\"\n"
                + "# \"unbalanced quote in a comment\n"
                + "per-author,A1,W9,,\n";

        DenyListCsvParser.Result result = DenyListCsvParser.parse(csv);
        List<ExclusionEntry> entries = result.getEntries();

        assertEquals(0, result.getSkippedRows());
        assertEquals(2, entries.size());
        assertEquals("graph\r\nbased \"learning\"", entries.get(0).getTitleSlug());
        assertEquals(ExclusionScope.PER_AUTHOR, entries.get(1).getScope());
        assertEquals("W9", entries.get(1).getWorkIdentifier());
    }

    @Test
    public void testRecordsKeepStartingLineNumber() {
        List<DenyListCsvParser.Record> records = DenyListCsvParser.splitRecords(
                "header\r\nglobal,,,,\"a\nb\nc\"\nglobal,,W2");

        assertEquals(3, records.size());
        assertEquals(1, records.get(0).lineNumber);
        assertEquals("header", records.get(0).text);
        assertEquals(2, records.get(1).lineNumber);
        assertEquals("global,,,,\"a\nb\nc\"", records.get(1).text);
        assertEquals(5, records.get(2).lineNumber);
    }

    @Test
    public void testEmptyContent() {
        assertTrue(DenyListCsvParser.parse(null).getEntries().isEmpty());
        assertTrue(DenyListCsvParser.parse("scope,authorId,workIdentifier,doi,titleSlug\n").getEntries().isEmpty());
    }
}
