package model.raw;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 16 字节文件头
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawHeader {
    private String arcdpsBuild;   // EVTCyyyymmdd 中的日期串
    private int revision;         // 事件布局修订号
    private int contentId;        // 首领/区域 id
}
