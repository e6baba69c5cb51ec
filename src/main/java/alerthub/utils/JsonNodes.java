package alerthub.utils;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

/**
 * 上游JSON结构不固定，所有字段都按可选读取
 */
public final class JsonNodes {

    private JsonNodes() {
    }

    /**
     * 读取文本字段，缺失、null或空白返回null
     */
    public static String text(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return StringUtils.trimToNull(value.asText());
    }

    public static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * 按路径取数组的第一个元素
     */
    public static JsonNode first(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode array = node.get(field);
        if (array == null || !array.isArray() || array.isEmpty()) {
            return null;
        }
        return array.get(0);
    }
}
