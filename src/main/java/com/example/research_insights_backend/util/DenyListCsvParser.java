package com.example.research_insights_backend.util;

import com.example.research_insights_backend.model.ExclusionEntry;
import com.example.research_insights_backend.model.ExclusionScope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 屏蔽名单 CSV 解析。
 * 列顺序固定：scope, authorId, workIdentifier, doi, titleSlug；首个非空非注释行为表头。
 * 列数不足5的行跳过，不中断解析。
 * 双引号包裹的字段可以跨行，引号内的换行属于字段内容。
 */
@Slf4j
public final class DenyListCsvParser {

    private static final int COLUMN_COUNT = 5;

    private DenyListCsvParser() {
    }

    public static Result parse(String content) {
        List<ExclusionEntry> entries = new ArrayList<>();
        int skipped = 0;
        if (content == null || content.isEmpty()) {
            return new Result(entries, skipped);
        }

        boolean headerSeen = false;
        for (Record record : splitRecords(content)) {
            String line = stripBom(record.text).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (!headerSeen) {
                headerSeen = true;
                continue;
            }
            List<String> cols = splitRow(line);
            if (cols.size() < COLUMN_COUNT) {
                skipped++;
                log.warn("屏蔽名单第{}行列数不足({}列)，已跳过: {}", record.lineNumber, cols.size(), line);
                continue;
            }
            entries.add(new ExclusionEntry(
                    ExclusionScope.fromToken(cols.get(0)),
                    emptyToNull(cols.get(1)),
                    emptyToNull(cols.get(2)),
                    emptyToNull(cols.get(3)),
                    emptyToNull(cols.get(4))));
        }
        return new Result(entries, skipped);
    }

    /**
     * 按换行切分记录，引号未闭合时换行并入当前记录；注释行不参与引号判断。
     * 引号的开闭规则与 {@link #splitRow(String)} 一致。
     */
    static List<Record> splitRecords(String content) {
        List<Record> records = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int line = 1;
        int startLine = 1;
        boolean quoted = false;
        boolean comment = false;
        boolean fieldBlank = true;
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\n' && !quoted) {
                records.add(new Record(startLine, stripTrailingCr(current)));
                current.setLength(0);
                line++;
                startLine = line;
                comment = false;
                fieldBlank = true;
                i++;
                continue;
            }
            if (c == '\n') {
                line++;
            }
            current.append(c);
            if (comment) {
                i++;
                continue;
            }
            if (quoted) {
                if ((c == '"' || c == '\\') && i + 1 < content.length() && content.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                    fieldBlank = false;
                }
            } else if (c == '#' && stripBom(current.toString()).trim().equals("#")) {
                comment = true;
            } else if (c == '"' && fieldBlank) {
                quoted = true;
            } else if (c == ',') {
                fieldBlank = true;
            } else if (!Character.isWhitespace(c) && c != '\uFEFF') {
                fieldBlank = false;
            }
            i++;
        }
        if (current.length() > 0) {
            records.add(new Record(startLine, stripTrailingCr(current)));
        }
        return records;
    }

    private static String stripTrailingCr(StringBuilder text) {
        int end = text.length();
        if (end > 0 && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(0, end);
    }

    /**
     * 按逗号拆分一行，支持双引号包裹的字段，引号内的 "" 还原为 "
     */
    static List<String> splitRow(String line) {
        List<String> cols = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else if (c == '\\' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    current.append(c);
                }
            } else if (c == '"' && current.toString().trim().isEmpty()) {
                current.setLength(0);
                quoted = true;
            } else if (c == ',') {
                cols.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
            i++;
        }
        cols.add(current.toString().trim());
        return cols;
    }

    private static String emptyToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    static final class Record {
        final int lineNumber;
        final String text;

        Record(int lineNumber, String text) {
            this.lineNumber = lineNumber;
            this.text = text;
        }
    }

    /**
     * 解析结果：有效规则 + 跳过的行数
     */
    public static final class Result {
        private final List<ExclusionEntry> entries;
        private final int skippedRows;

        public Result(List<ExclusionEntry> entries, int skippedRows) {
            this.entries = Collections.unmodifiableList(entries);
            this.skippedRows = skippedRows;
        }

        public List<ExclusionEntry> getEntries() {
            return entries;
        }

        public int getSkippedRows() {
            return skippedRows;
        }
    }
}
