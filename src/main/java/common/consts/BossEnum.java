package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 首领种类 id 与所属战斗
 * 一个战斗可以有多个首领（双子、兄弟、Xera 二阶段）
 */
@Getter
@AllArgsConstructor
public enum BossEnum {
    VALE_GUARDIAN(0x3C4E, "Vale Guardian", EncounterEnum.VALE_GUARDIAN),
    GORSEVAL(0x3C45, "Gorseval", EncounterEnum.GORSEVAL),
    SABETHA(0x3C0F, "Sabetha", EncounterEnum.SABETHA),
    SLOTHASOR(0x3EFB, "Slothasor", EncounterEnum.SLOTHASOR),
    MATTHIAS(0x3EF3, "Matthias Gabrel", EncounterEnum.MATTHIAS),
    KEEP_CONSTRUCT(0x3F6B, "Keep Construct", EncounterEnum.KEEP_CONSTRUCT),
    XERA(0x3F76, "Xera", EncounterEnum.XERA),
    XERA_2(0x3F9E, "Xera", EncounterEnum.XERA),
    CAIRN(0x432A, "Cairn the Indomitable", EncounterEnum.CAIRN),
    MURSAAT_OVERSEER(0x4314, "Mursaat Overseer", EncounterEnum.MURSAAT_OVERSEER),
    SAMAROG(0x4324, "Samarog", EncounterEnum.SAMAROG),
    DEIMOS(0x4302, "Deimos", EncounterEnum.DEIMOS),
    SOULLESS_HORROR(0x4D37, "Soulless Horror", EncounterEnum.SOULLESS_HORROR),
    DHUUM(0x4BFA, "Dhuum", EncounterEnum.VOICE_IN_THE_VOID),
    CONJURED_AMALGAMATE(0xABC6, "Conjured Amalgamate", EncounterEnum.CONJURED_AMALGAMATE),
    NIKARE(0x5271, "Nikare", EncounterEnum.TWIN_LARGOS),
    KENUT(0x5261, "Kenut", EncounterEnum.TWIN_LARGOS),
    QADIM(0x51C6, "Qadim", EncounterEnum.QADIM),
    CARDINAL_ADINA(0x55F6, "Cardinal Adina", EncounterEnum.CARDINAL_ADINA),
    CARDINAL_SABIR(0x55CC, "Cardinal Sabir", EncounterEnum.CARDINAL_SABIR),
    QADIM_THE_PEERLESS(0x55F0, "Qadim the Peerless", EncounterEnum.QADIM_THE_PEERLESS),
    STANDARD_KITTY_GOLEM(0x3F47, "Standard Kitty Golem", EncounterEnum.STANDARD_KITTY_GOLEM),
    MEDIUM_KITTY_GOLEM(0x4CBD, "Medium Kitty Golem", EncounterEnum.MEDIUM_KITTY_GOLEM),
    LARGE_KITTY_GOLEM(0x4CDC, "Large Kitty Golem", EncounterEnum.LARGE_KITTY_GOLEM),
    AI(0x5AD6, "Ai Keeper of the Peak", EncounterEnum.AI),
    SKORVALD(0x44E0, "Skorvald the Shattered", EncounterEnum.SKORVALD),
    ARTSARIIV(0x461D, "Artsariiv", EncounterEnum.ARTSARIIV),
    ARKK(0x455F, "Arkk", EncounterEnum.ARKK),
    MAMA(0x427D, "MAMA", EncounterEnum.MAMA),
    SIAX(0x4284, "Siax the Corrupted", EncounterEnum.SIAX),
    ENSOLYSS(0x4234, "Ensolyss of the Endless Torment", EncounterEnum.ENSOLYSS),
    ICEBROOD_CONSTRUCT(0x568A, "Icebrood Construct", EncounterEnum.ICEBROOD_CONSTRUCT),
    VOICE_OF_THE_FALLEN(0x5747, "Voice of the Fallen", EncounterEnum.SUPER_KODAN_BROTHERS),
    CLAW_OF_THE_FALLEN(0x57D1, "Claw of the Fallen", EncounterEnum.SUPER_KODAN_BROTHERS),
    FRAENIR_OF_JORMAG(0x57DC, "Fraenir of Jormag", EncounterEnum.FRAENIR_OF_JORMAG),
    BONESKINNER(0x57F9, "Boneskinner", EncounterEnum.BONESKINNER),
    WHISPER_OF_JORMAG(0x58B7, "Whisper of Jormag", EncounterEnum.WHISPER_OF_JORMAG);

    private final int code;
    private final String desc;
    private final EncounterEnum encounter;

    public static BossEnum getByCode(int code) {
        for (BossEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return null;
    }
}
