package com.eainde.bidding.agent;

/**
 * Names of the standard tender extraction agents. Also the section keys of the report.
 *
 * <pre>
 *   basic-info        → 基础信息      (project, budget, deadlines, parties, qualification)
 *   scoring-criteria  → 评分标准      (evaluation method, score split, disqualification)
 *   other-terms       → 其他重要信息  (contract, payment, delivery, IP, risks)
 * </pre>
 */
public final class AgentNames {

    private AgentNames() {}

    public static final String BASIC_INFO = "basic-info";
    public static final String SCORING_CRITERIA = "scoring-criteria";
    public static final String OTHER_TERMS = "other-terms";
}
