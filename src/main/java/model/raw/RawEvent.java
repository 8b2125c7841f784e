package model.raw;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条 64 字节事件记录，未做任何解释
 * 修订版 0 中不存在的字段（dstMasterInstId、offcycle）保持默认值
 */
@Data
@NoArgsConstructor
public class RawEvent {
    private long time;
    private long srcAgent;
    private long dstAgent;
    private int value;
    private int buffDmg;
    private long overstackValue;
    private long skillId;
    private int srcInstId;
    private int dstInstId;
    private int srcMasterInstId;
    private int dstMasterInstId;
    private int iff;
    private int buff;
    private int result;
    private int isActivation;
    private int isBuffRemove;
    private boolean ninety;
    private boolean fifty;
    private boolean moving;
    private int isStateChange;
    private boolean flanking;
    private boolean shields;
    private boolean offcycle;
    // 内部保留字节，原样保存
    private byte[] internal;
}
