package model.bo;

import common.consts.DecodeWarningEnum;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次解析的告警收集器，每次解析新建一个，不在解析之间共享
 */
public class DecodeWarnings {

    private final List<DecodeWarning> warnings = new ArrayList<>();
    // field:code -> 出现次数，保持首次出现顺序
    private final Map<String, Integer> unrecognized = new LinkedHashMap<>();

    public void add(DecodeWarningEnum type, String message) {
        warnings.add(new DecodeWarning(type, message, 1));
    }

    public void unrecognizedCode(String field, int code) {
        unrecognized.merge(field + ":" + code, 1, Integer::sum);
    }

    public boolean isEmpty() {
        return warnings.isEmpty() && unrecognized.isEmpty();
    }

    public List<DecodeWarning> toList() {
        List<DecodeWarning> out = new ArrayList<>(warnings);
        for (Map.Entry<String, Integer> entry : unrecognized.entrySet()) {
            out.add(new DecodeWarning(DecodeWarningEnum.UNRECOGNIZED_CODE,
                    DecodeWarningEnum.UNRECOGNIZED_CODE.getDesc() + " " + entry.getKey(), entry.getValue()));
        }
        return out;
    }
}
