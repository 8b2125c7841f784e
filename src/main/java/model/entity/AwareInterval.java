package model.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 某地址持有某实例号的时间区间 [firstAware, lastAware)
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class AwareInterval {
    private final int instanceId;
    private final long firstAware;
    private final long lastAware;

    public boolean contains(long time) {
        return time >= firstAware && time < lastAware;
    }

    public boolean overlaps(AwareInterval other) {
        return firstAware < other.lastAware && other.firstAware < lastAware;
    }
}
