package engine.build;

import common.exception.EvtcParseException;
import model.entity.AwareInterval;

import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 实例号 -> 按起始时间排序的占用区间
 * 实例号会在参与者离开后被回收，任何按实例号的查找都必须带上事件时间
 */
public class InstanceIdTimeline {

    private final Map<Integer, NavigableMap<Long, Binding>> bindings = new HashMap<>();

    private static class Binding {
        final long addr;
        final AwareInterval interval;

        Binding(long addr, AwareInterval interval) {
            this.addr = addr;
            this.interval = interval;
        }
    }

    /**
     * 登记一个占用区间；与其他地址的区间重叠说明源数据自相矛盾
     */
    public void bind(long addr, AwareInterval interval) {
        NavigableMap<Long, Binding> timeline = bindings.computeIfAbsent(interval.getInstanceId(), k -> new TreeMap<>());
        Map.Entry<Long, Binding> before = timeline.floorEntry(interval.getFirstAware());
        Map.Entry<Long, Binding> after = timeline.ceilingEntry(interval.getFirstAware());
        checkOverlap(before, addr, interval);
        checkOverlap(after, addr, interval);
        timeline.put(interval.getFirstAware(), new Binding(addr, interval));
    }

    private void checkOverlap(Map.Entry<Long, Binding> neighbour, long addr, AwareInterval interval) {
        if (neighbour == null || neighbour.getValue().addr == addr
                || !neighbour.getValue().interval.overlaps(interval)) {
            return;
        }
        long time = Math.max(neighbour.getValue().interval.getFirstAware(), interval.getFirstAware());
        throw EvtcParseException.instanceConflict(interval.getInstanceId(), neighbour.getValue().addr, addr, time);
    }

    /**
     * 某时刻持有该实例号的地址，没有则返回 null
     */
    public Long addressAt(int instanceId, long time) {
        NavigableMap<Long, Binding> timeline = bindings.get(instanceId);
        if (timeline == null) {
            return null;
        }
        Map.Entry<Long, Binding> entry = timeline.floorEntry(time);
        if (entry == null || !entry.getValue().interval.contains(time)) {
            return null;
        }
        return entry.getValue().addr;
    }
}
