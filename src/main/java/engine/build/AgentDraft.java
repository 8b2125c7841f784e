package engine.build;

import model.entity.AgentKind;
import model.entity.AwareInterval;
import model.raw.RawAgent;

import java.util.ArrayList;
import java.util.List;

/**
 * 构建过程中的可变参与者状态，只在 DomainBuilder 内部使用
 */
class AgentDraft {

    final RawAgent raw;
    final AgentKind kind;
    int instanceId;
    final List<long[]> intervals = new ArrayList<>();   // {instanceId, first, last}
    Long masterAddr;
    // 离开视野后下一次出现必须开新区间
    boolean despawned;

    AgentDraft(RawAgent raw, AgentKind kind) {
        this.raw = raw;
        this.kind = kind;
    }

    long addr() {
        return raw.getAddr();
    }

    /**
     * 记录一次出现：实例号变化或离开视野后重新出现时开新区间，否则延长当前区间，区间右端为最后出现时间 + 1
     */
    void sighted(int instId, long time) {
        instanceId = instId;
        long[] current = intervals.isEmpty() ? null : intervals.get(intervals.size() - 1);
        if (current == null || despawned || current[0] != instId) {
            despawned = false;
            intervals.add(new long[]{instId, time, time + 1});
        } else if (time + 1 > current[2]) {
            current[2] = time + 1;
        }
    }

    /**
     * 离开视野：关闭当前区间，区间右端保持最后一次出现时间 + 1
     */
    void leftTracking() {
        despawned = true;
    }

    List<AwareInterval> freezeIntervals() {
        List<AwareInterval> out = new ArrayList<>(intervals.size());
        for (long[] interval : intervals) {
            out.add(new AwareInterval((int) interval[0], interval[1], interval[2]));
        }
        return out;
    }
}
