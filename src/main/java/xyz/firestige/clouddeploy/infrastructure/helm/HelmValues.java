package xyz.firestige.clouddeploy.infrastructure.helm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型化的 chart 取值集合：既可渲染成 override 文件的嵌套结构，也可渲染成 --set 参数
 */
public class HelmValues {

    private final Map<HelmValue, Object> values = new EnumMap<>(HelmValue.class);

    public static HelmValues create() {
        return new HelmValues();
    }

    public HelmValues put(HelmValue key, Object value) {
        if (value == null) {
            values.remove(key);
            return this;
        }
        if (!key.getType().isInstance(value)) {
            throw new IllegalArgumentException(key + " expects " + key.getType().getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
        values.put(key, value);
        return this;
    }

    public Object get(HelmValue key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<HelmValue, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * 字符串值使用 --set-string，避免 "true"/"1" 之类被 helm 转换类型
     */
    public List<String> toSetArguments() {
        List<String> args = new ArrayList<>();
        for (Map.Entry<HelmValue, Object> e : values.entrySet()) {
            boolean string = e.getKey().getType() == String.class;
            args.add(string ? "--set-string" : "--set");
            args.add(e.getKey().setKey() + "=" + escapeValue(e.getValue().toString()));
        }
        return args;
    }

    /**
     * 嵌套 Map，用于序列化为 values 覆盖文件
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> toNestedMap() {
        Map<String, Object> root = new LinkedHashMap<>();
        for (Map.Entry<HelmValue, Object> e : values.entrySet()) {
            List<String> path = e.getKey().getPath();
            Map<String, Object> node = root;
            for (int i = 0; i < path.size() - 1; i++) {
                node = (Map<String, Object>) node.computeIfAbsent(path.get(i), k -> new LinkedHashMap<String, Object>());
            }
            node.put(path.get(path.size() - 1), e.getValue());
        }
        return root;
    }

    static String escapeValue(String value) {
        return value.replace("\\", "\\\\").replace(",", "\\,");
    }
}
