package model.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import model.entity.payload.EventPayload;

/**
 * 已分类事件
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Event {
    private final long time;
    private final long srcAddr;
    private final long dstAddr;
    private final EventPayload payload;
    // 目标血量高于 90% / 低于 50%
    private final boolean ninety;
    private final boolean fifty;
    private final boolean moving;
    private final boolean flanking;
    private final boolean shields;
    private final boolean offcycle;
}
