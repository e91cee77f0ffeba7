package com.example.research_insights_backend.engine;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 文献标识规范化工具：把外部标识、DOI、标题+年份转换成可直接做集合比较的形式。
 * 所有方法都是全函数，空输入返回空字符串，不抛异常。
 */
public final class IdentityCanonicalizer {

    // 注册表地址前缀，例如 https://openalex.org/ 或 https://www.openalex.org/
    private static final Pattern REGISTRY_PREFIX = Pattern.compile("^(?:https?://(?:www\\.)?[^/\\s]+/)+");

    // DOI 解析地址或 doi: 前缀
    private static final Pattern DOI_PREFIX = Pattern.compile("^(?:https?://(?:www\\.|dx\\.)?doi\\.org/|doi:)+");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern DASHES = Pattern.compile("[\\p{Pd}\\u2212]");
    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^\\p{L}\\p{N}\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IdentityCanonicalizer() {
    }

    /**
     * 去空白并转小写，用于作者标识等无前缀的键
     */
    public static String normalizeKey(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 外部标识规范化：去掉注册表地址前缀，只保留末尾的裸标识
     */
    public static String canonicalWorkId(String value) {
        String id = normalizeKey(value);
        return REGISTRY_PREFIX.matcher(id).replaceFirst("").trim();
    }

    /**
     * DOI 规范化：去掉 doi.org 解析地址或 doi: 前缀
     */
    public static String canonicalDoi(String value) {
        String doi = normalizeKey(value);
        return DOI_PREFIX.matcher(doi).replaceFirst("").trim();
    }

    /**
     * 标题+年份生成 slug，年份为空时只用标题
     */
    public static String titleSlug(String title, Integer year) {
        String raw = (title == null ? "" : title) + " " + (year == null ? "" : year.toString());
        return slugify(raw);
    }

    /**
     * 生成 slug：小写、去变音符号、各类连字符统一为 "-"、其它符号替换为空格、
     * 合并空白后用 "-" 连接。对已经是 slug 的输入结果不变。
     */
    public static String slugify(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String s = raw.trim().toLowerCase(Locale.ROOT);
        s = Normalizer.normalize(s, Normalizer.Form.NFD);
        s = COMBINING_MARKS.matcher(s).replaceAll("");
        s = DASHES.matcher(s).replaceAll("-");
        s = NON_SLUG_CHARS.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        return WHITESPACE.matcher(s).replaceAll("-");
    }
}
