package model.dto.response;

import lombok.Data;

/**
 * 玩家摘要
 */
@Data
public class PlayerSummaryDto {
    private String characterName;
    private String accountName;
    private int subgroup;
    private String profession;
    private String eliteSpec;
}
