package com.example.research_insights_backend.util;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一响应封装：{success, data | message}
 */
public class ResponseUtil {
    public static Map<String, Object> success(Object data) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        if (data instanceof Collection) {
            result.put("total", ((Collection<?>) data).size());
        }
        result.put("data", data);
        return result;
    }

    public static Map<String, Object> successMsg(String msg) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("message", msg);
        return result;
    }

    public static Map<String, Object> error(String msg) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("message", msg);
        return result;
    }
}
