package model.raw;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 结构层解析结果
 */
@Getter
@AllArgsConstructor
public class RawEvtc {
    private final RawHeader header;
    private final List<RawAgent> agents;
    private final List<RawSkill> skills;
    private final List<RawEvent> events;
}
