package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 战斗（首领战）标识，code 与主首领的种类 id 一致
 */
@Getter
@AllArgsConstructor
public enum EncounterEnum {
    // 团队副本 W1
    VALE_GUARDIAN(0x3C4E, "Vale Guardian"),
    GORSEVAL(0x3C45, "Gorseval"),
    SABETHA(0x3C0F, "Sabetha"),
    // W2
    SLOTHASOR(0x3EFB, "Slothasor"),
    MATTHIAS(0x3EF3, "Matthias Gabrel"),
    // W3
    KEEP_CONSTRUCT(0x3F6B, "Keep Construct"),
    XERA(0x3F76, "Xera"),
    // W4
    CAIRN(0x432A, "Cairn the Indomitable"),
    MURSAAT_OVERSEER(0x4314, "Mursaat Overseer"),
    SAMAROG(0x4324, "Samarog"),
    DEIMOS(0x4302, "Deimos"),
    // W5
    SOULLESS_HORROR(0x4D37, "Soulless Horror"),
    VOICE_IN_THE_VOID(0x4BFA, "Voice in the Void"),
    // W6
    CONJURED_AMALGAMATE(0xABC6, "Conjured Amalgamate"),
    TWIN_LARGOS(0x5271, "Twin Largos"),
    QADIM(0x51C6, "Qadim"),
    // W7
    CARDINAL_ADINA(0x55F6, "Cardinal Adina"),
    CARDINAL_SABIR(0x55CC, "Cardinal Sabir"),
    QADIM_THE_PEERLESS(0x55F0, "Qadim the Peerless"),
    // 训练场
    STANDARD_KITTY_GOLEM(0x3F47, "Standard Kitty Golem"),
    MEDIUM_KITTY_GOLEM(0x4CBD, "Medium Kitty Golem"),
    LARGE_KITTY_GOLEM(0x4CDC, "Large Kitty Golem"),
    // 碎层挑战
    AI(0x5AD6, "Ai Keeper of the Peak"),
    SKORVALD(0x44E0, "Skorvald the Shattered"),
    ARTSARIIV(0x461D, "Artsariiv"),
    ARKK(0x455F, "Arkk"),
    MAMA(0x427D, "MAMA"),
    SIAX(0x4284, "Siax the Corrupted"),
    ENSOLYSS(0x4234, "Ensolyss of the Endless Torment"),
    // 攻坚任务
    ICEBROOD_CONSTRUCT(0x568A, "Icebrood Construct"),
    SUPER_KODAN_BROTHERS(0x5747, "Super Kodan Brothers"),
    FRAENIR_OF_JORMAG(0x57DC, "Fraenir of Jormag"),
    BONESKINNER(0x57F9, "Boneskinner"),
    WHISPER_OF_JORMAG(0x58B7, "Whisper of Jormag");

    private final int code;
    private final String desc;

    /**
     * 该战斗需要跟踪的首领列表
     */
    public List<BossEnum> getBosses() {
        List<BossEnum> bosses = new ArrayList<>();
        for (BossEnum boss : BossEnum.values()) {
            if (boss.getEncounter() == this) {
                bosses.add(boss);
            }
        }
        return bosses;
    }

    public static EncounterEnum getByCode(int code) {
        for (EncounterEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return null;
    }
}
