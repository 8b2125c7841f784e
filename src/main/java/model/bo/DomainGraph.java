package model.bo;

import lombok.AllArgsConstructor;
import lombok.Getter;
import model.entity.Agent;
import model.entity.Skill;
import model.raw.RawEvent;

import java.util.List;

/**
 * 身份解析完成后的参与者与技能，连同原始事件按原顺序交给事件分类
 */
@Getter
@AllArgsConstructor
public class DomainGraph {
    private final List<Agent> agents;
    private final List<Skill> skills;
    private final List<RawEvent> rawEvents;
}
