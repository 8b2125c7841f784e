package model.raw;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 参与者表中的一条 96 字节记录
 * 名称缓冲区保持原始字节：玩家记录中打包了角色名、账号名与小队号三段
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawAgent {
    private long addr;
    private long prof;        // u32
    private long isElite;     // u32，0xFFFFFFFF 表示非玩家
    private short toughness;
    private short concentration;
    private short healing;
    private short condition;
    private byte[] name;      // 64 字节
}
