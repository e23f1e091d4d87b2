package com.phillippitts.factopinion.config.properties;

import com.phillippitts.factopinion.service.rules.Lexicon;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Cue lists for the linguistic rule scorer.
 *
 * <p>Defaults cover common Mandarin hedges, stance markers and citation phrases; override
 * them in application.properties to recalibrate without code changes:
 * <pre>
 * factopinion.lexicon.opinion-cues=我觉得,我认为,可能
 * factopinion.lexicon.fact-cues=根据,数据显示
 * factopinion.lexicon.degree-adverbs=很,非常
 * </pre>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "factopinion.lexicon")
public class LexiconProperties {

    /** Subjective-stance phrases; each one present subtracts 1. */
    @NotEmpty
    private List<String> opinionCues = new ArrayList<>(List.of(
            "我觉得", "我认为", "我相信", "我猜", "个人认为", "在我看来", "可能", "也许", "或许",
            "大概", "恐怕", "似乎", "好像", "应该", "估计", "说实话", "不得不说", "显然", "无疑"));

    /** Citation and evidence phrases; each one present adds 1. */
    @NotEmpty
    private List<String> factCues = new ArrayList<>(List.of(
            "根据", "据报道", "据悉", "数据显示", "数据表明", "研究表明", "研究显示", "调查显示",
            "统计", "证实", "报告指出", "资料显示", "官方", "公布"));

    /** Degree / intensity adverbs; an ADV token in this list subtracts 0.5. */
    @NotEmpty
    private List<String> degreeAdverbs = new ArrayList<>(List.of(
            "很", "非常", "十分", "特别", "极其", "太", "相当", "挺", "真", "超", "最", "更",
            "比较", "尤其", "格外"));

    public List<String> getOpinionCues() {
        return opinionCues;
    }

    public void setOpinionCues(List<String> opinionCues) {
        this.opinionCues = opinionCues;
    }

    public List<String> getFactCues() {
        return factCues;
    }

    public void setFactCues(List<String> factCues) {
        this.factCues = factCues;
    }

    public List<String> getDegreeAdverbs() {
        return degreeAdverbs;
    }

    public void setDegreeAdverbs(List<String> degreeAdverbs) {
        this.degreeAdverbs = degreeAdverbs;
    }

    /**
     * @return immutable snapshot of the configured lists
     */
    public Lexicon toLexicon() {
        return Lexicon.of(opinionCues, factCues, degreeAdverbs);
    }
}
