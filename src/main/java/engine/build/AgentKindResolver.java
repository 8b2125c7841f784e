package engine.build;

import common.consts.AgentKindEnum;
import common.consts.DecodeWarningEnum;
import common.util.TextUtil;
import model.bo.DecodeWarnings;
import model.entity.AgentKind;
import model.entity.Gadget;
import model.entity.NpcCharacter;
import model.entity.Player;

/**
 * 参与者类别判定（纯函数）
 */
public final class AgentKindResolver {

    public static final long ALL_BITS_SET = 0xFFFFFFFFL;

    private AgentKindResolver() {}

    /**
     * elite 全 1 且 prof 高 16 位全 1 为装置；elite 全 1 为 NPC；其余为玩家
     */
    public static AgentKindEnum classify(long professionCode, long eliteCode) {
        if (eliteCode == ALL_BITS_SET) {
            if ((professionCode >>> 16) == 0xFFFF) {
                return AgentKindEnum.GADGET;
            }
            return AgentKindEnum.CHARACTER;
        }
        return AgentKindEnum.PLAYER;
    }

    public static AgentKind resolve(long professionCode, long eliteCode, byte[] nameBuffer, DecodeWarnings warnings) {
        AgentKindEnum type = classify(professionCode, eliteCode);
        TextUtil.DecodedText name = TextUtil.decode(nameBuffer);
        if (!name.isValid()) {
            warnings.add(DecodeWarningEnum.INVALID_TEXT, "参与者名称: " + name.getText());
        }
        int lowBits = (int) (professionCode & 0xFFFF);
        switch (type) {
            case GADGET:
                return new Gadget(lowBits, name.getText());
            case CHARACTER:
                return new NpcCharacter(lowBits, name.getText());
            case PLAYER:
                return resolvePlayer(professionCode, eliteCode, nameBuffer, name, warnings);
            default:
                throw new IllegalStateException("未处理的参与者类别: " + type);
        }
    }

    // 玩家名称缓冲区：角色名 \0 账号名 \0 小队号
    private static Player resolvePlayer(long professionCode, long eliteCode, byte[] buf,
                                        TextUtil.DecodedText characterName, DecodeWarnings warnings) {
        TextUtil.DecodedText account = TextUtil.decode(buf, characterName.getNext(), buf.length);
        if (!account.isValid()) {
            warnings.add(DecodeWarningEnum.INVALID_TEXT, "账号名: " + account.getText());
        }
        TextUtil.DecodedText subgroupText = TextUtil.decode(buf, account.getNext(), buf.length);
        int subgroup = 0;
        String literal = subgroupText.getText().trim();
        if (!literal.isEmpty()) {
            try {
                subgroup = Integer.parseInt(literal);
            } catch (NumberFormatException e) {
                warnings.add(DecodeWarningEnum.INVALID_TEXT,
                        "玩家 " + characterName.getText() + " 的小队号无效: " + literal);
            }
        }
        return new Player(professionCode, eliteCode, characterName.getText(), account.getText(), subgroup);
    }
}
