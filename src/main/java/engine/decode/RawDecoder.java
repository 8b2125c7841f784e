package engine.decode;

import common.consts.DecodeWarningEnum;
import common.exception.EvtcParseException;
import common.util.ByteReader;
import common.util.TextUtil;
import lombok.extern.slf4j.Slf4j;
import model.bo.DecodeWarnings;
import model.raw.RawAgent;
import model.raw.RawEvent;
import model.raw.RawEvtc;
import model.raw.RawHeader;
import model.raw.RawSkill;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * EVTC 二进制结构解析（小端）
 * 只切分字段，不做语义解释；无状态，可并发调用
 */
@Component
@Slf4j
public class RawDecoder {

    public static final byte[] MAGIC = "EVTC".getBytes(StandardCharsets.US_ASCII);
    public static final int HEADER_SIZE = 16;
    public static final int AGENT_RECORD_SIZE = 96;
    public static final int SKILL_RECORD_SIZE = 68;
    public static final int EVENT_RECORD_SIZE = 64;
    public static final int NAME_SIZE = 64;
    // 已知的最新事件布局
    public static final int LATEST_REVISION = 1;

    public RawEvtc decode(byte[] data, DecodeWarnings warnings) {
        ByteReader reader = new ByteReader(data);
        RawHeader header = decodeHeader(reader, warnings);
        List<RawAgent> agents = decodeAgentTable(reader);
        List<RawSkill> skills = decodeSkillTable(reader, warnings);
        List<RawEvent> events = decodeEvents(reader, header.getRevision());
        log.debug("结构解析完成: build={}, rev={}, agents={}, skills={}, events={}",
                header.getArcdpsBuild(), header.getRevision(), agents.size(), skills.size(), events.size());
        return new RawEvtc(header, agents, skills, events);
    }

    /**
     * magic(4) + 日期串(8) + 修订号(1) + 内容 id(u16) + 保留(1)
     */
    public RawHeader decodeHeader(ByteReader reader, DecodeWarnings warnings) {
        if (reader.remaining() < MAGIC.length) {
            throw EvtcParseException.badMagic(reader.remaining());
        }
        byte[] magic = reader.bytes("header", MAGIC.length);
        for (int i = 0; i < MAGIC.length; i++) {
            if (magic[i] != MAGIC[i]) {
                throw EvtcParseException.badMagic(reader.remaining() + MAGIC.length);
            }
        }
        reader.require("header", HEADER_SIZE - MAGIC.length);

        TextUtil.DecodedText build = TextUtil.decode(reader.bytes("header", 8));
        if (!build.isValid()) {
            warnings.add(DecodeWarningEnum.INVALID_TEXT, "arcdps 版本串: " + build.getText());
        }
        int revision = reader.u8("header");
        int contentId = reader.u16("header");
        reader.skip("header", 1);

        if (revision > LATEST_REVISION) {
            warnings.add(DecodeWarningEnum.UNSUPPORTED_REVISION,
                    "修订版本 " + revision + "，按修订版本 " + LATEST_REVISION + " 的布局解析");
        }
        return new RawHeader(build.getText(), revision, contentId);
    }

    public List<RawAgent> decodeAgentTable(ByteReader reader) {
        long count = reader.u32("agent count");
        reader.requireRecords("agent table", count, AGENT_RECORD_SIZE);

        List<RawAgent> agents = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            RawAgent agent = new RawAgent();
            agent.setAddr(reader.u64("agent"));
            agent.setProf(reader.u32("agent"));
            agent.setIsElite(reader.u32("agent"));
            agent.setToughness(reader.i16("agent"));
            agent.setConcentration(reader.i16("agent"));
            agent.setHealing(reader.i16("agent"));
            reader.skip("agent", 2);
            agent.setCondition(reader.i16("agent"));
            reader.skip("agent", 2);
            agent.setName(reader.bytes("agent", NAME_SIZE));
            reader.skip("agent", 4);
            agents.add(agent);
        }
        return agents;
    }

    public List<RawSkill> decodeSkillTable(ByteReader reader, DecodeWarnings warnings) {
        long count = reader.u32("skill count");
        reader.requireRecords("skill table", count, SKILL_RECORD_SIZE);

        List<RawSkill> skills = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            int id = reader.i32("skill");
            TextUtil.DecodedText name = TextUtil.decode(reader.bytes("skill", NAME_SIZE));
            if (!name.isValid()) {
                warnings.add(DecodeWarningEnum.INVALID_TEXT, "技能 " + id + " 名称: " + name.getText());
            }
            skills.add(new RawSkill(id, name.getText()));
        }
        return skills;
    }

    /**
     * 读取到输入结束；末尾不足一条记录说明捕获在写入中途被截断
     */
    public List<RawEvent> decodeEvents(ByteReader reader, int revision) {
        int partial = reader.remaining() % EVENT_RECORD_SIZE;
        if (partial != 0) {
            long offset = reader.position() + (long) (reader.remaining() - partial);
            throw EvtcParseException.truncated("event", offset, EVENT_RECORD_SIZE, partial);
        }
        List<RawEvent> events = new ArrayList<>(reader.remaining() / EVENT_RECORD_SIZE);
        while (reader.hasRemaining()) {
            events.add(revision == 0 ? readRevision0(reader) : readRevision1(reader));
        }
        return events;
    }

    private RawEvent readRevision0(ByteReader reader) {
        RawEvent event = readCommonHead(reader);
        event.setOverstackValue(reader.u16("event"));
        event.setSkillId(reader.u16("event"));
        event.setSrcInstId(reader.u16("event"));
        event.setDstInstId(reader.u16("event"));
        event.setSrcMasterInstId(reader.u16("event"));
        byte[] internal = new byte[11];
        System.arraycopy(reader.bytes("event", 9), 0, internal, 0, 9);
        readFlags(reader, event);
        System.arraycopy(reader.bytes("event", 2), 0, internal, 9, 2);
        event.setInternal(internal);
        return event;
    }

    private RawEvent readRevision1(ByteReader reader) {
        RawEvent event = readCommonHead(reader);
        event.setOverstackValue(reader.u32("event"));
        event.setSkillId(reader.u32("event"));
        event.setSrcInstId(reader.u16("event"));
        event.setDstInstId(reader.u16("event"));
        event.setSrcMasterInstId(reader.u16("event"));
        event.setDstMasterInstId(reader.u16("event"));
        readFlags(reader, event);
        event.setOffcycle(reader.u8("event") != 0);
        event.setInternal(reader.bytes("event", 4));
        return event;
    }

    private RawEvent readCommonHead(ByteReader reader) {
        RawEvent event = new RawEvent();
        event.setTime(reader.u64("event"));
        event.setSrcAgent(reader.u64("event"));
        event.setDstAgent(reader.u64("event"));
        event.setValue(reader.i32("event"));
        event.setBuffDmg(reader.i32("event"));
        return event;
    }

    // iff .. shields，两个修订版本顺序一致
    private void readFlags(ByteReader reader, RawEvent event) {
        event.setIff(reader.u8("event"));
        event.setBuff(reader.u8("event"));
        event.setResult(reader.u8("event"));
        event.setIsActivation(reader.u8("event"));
        event.setIsBuffRemove(reader.u8("event"));
        event.setNinety(reader.u8("event") != 0);
        event.setFifty(reader.u8("event") != 0);
        event.setMoving(reader.u8("event") != 0);
        event.setIsStateChange(reader.u8("event"));
        event.setFlanking(reader.u8("event") != 0);
        event.setShields(reader.u8("event") != 0);
    }
}
