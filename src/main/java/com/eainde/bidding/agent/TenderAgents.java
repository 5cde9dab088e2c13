package com.eainde.bidding.agent;

import static com.eainde.bidding.agent.FieldSpec.of;

/**
 * The standard tender (招标文件) field catalogue, split across three agents.
 *
 * <p>Each field carries a primary semantic query plus the keyword queries tender documents
 * typically use for it; the keywords serve as alternates in later retrieval rounds.</p>
 */
public final class TenderAgents {

    private TenderAgents() {}

    public static AgentRegistry standardRegistry() {
        return AgentRegistry.of(basicInfo(), scoringCriteria(), otherTerms());
    }

    public static AgentSpec basicInfo() {
        return AgentSpec.of(AgentNames.BASIC_INFO, "基础信息")
                .description("Project identity, budget, deadlines, bid bond, parties and bidder qualification")
                .fields(
                        of("project_name", "项目名称", "本次招标的项目名称",
                                "项目的完整名称", "项目名称 招标编号", "采购项目名称"),
                        of("tender_number", "招标编号", "招标编号 项目编号",
                                "招标编号或采购项目编号", "项目名称 招标编号", "采购编号 项目编号"),
                        of("budget_amount", "预算金额", "项目预算金额 采购预算",
                                "预算金额，包含币种和单位", "预算金额 采购金额", "最高限价 控制价"),
                        of("bid_deadline", "投标截止时间", "投标截止时间",
                                "投标截止的具体日期和时间", "投标截止时间 开标时间", "递交投标文件截止时间"),
                        of("bid_opening_time", "开标时间", "开标时间 开标地点",
                                "开标的具体日期和时间", "投标截止时间 开标时间"),
                        of("bid_bond_amount", "投标保证金", "投标保证金金额",
                                "投标保证金金额，包含币种", "投标保证金", "保证金 金额"),
                        of("bid_bond_account", "保证金账户", "投标保证金缴纳账户",
                                "保证金缴纳账户信息：户名、账号、开户行", "投标保证金 账户 开户行"),
                        of("purchaser_name", "采购人", "采购人名称",
                                "采购人（招标人）名称", "采购人 采购代理机构", "招标人"),
                        of("purchaser_contact", "采购人联系方式", "采购人联系人 联系方式",
                                "采购人联系人及电话", "联系方式 联系人"),
                        of("agent_name", "采购代理机构", "采购代理机构名称",
                                "采购代理机构（招标代理）名称", "采购人 采购代理机构", "招标代理机构"),
                        of("agent_contact", "代理机构联系方式", "采购代理机构联系人 联系方式",
                                "采购代理机构联系人及电话", "联系方式 联系人"),
                        of("company_certifications", "企业资质要求", "投标人资格要求 企业资质",
                                "投标人须具备的企业资质、许可证和认证", "资格审查 资质要求", "企业资质 营业执照", "体系认证 ISO认证"),
                        of("project_experience", "业绩要求", "类似项目业绩要求",
                                "类似项目业绩要求：数量、金额、时间范围", "项目业绩 类似项目"),
                        of("team_requirements", "人员要求", "项目团队人员要求",
                                "项目团队人员要求：岗位、资格证书、经验年限", "项目经理 技术负责人"),
                        of("other_requirements", "其他资格要求", "其他资格条件",
                                "其他硬性要求，如财务状况、信誉、社保纳税", "财务状况 注册资金"))
                .build();
    }

    public static AgentSpec scoringCriteria() {
        return AgentSpec.of(AgentNames.SCORING_CRITERIA, "评分标准")
                .description("Evaluation method, score composition, detailed scoring, bonus and disqualification clauses")
                .fields(
                        of("preliminary_review", "初步评审", "初步评审 符合性审查",
                                "初步评审（资格性、符合性审查）的通过条件", "资格性审查 符合性审查"),
                        of("evaluation_method", "评标方法", "评标办法 评标方法",
                                "评标方法，如综合评估法、最低评标价法", "评分标准 评分方法 评标办法"),
                        of("technical_score", "技术分", "技术分 技术部分分值",
                                "技术分的分值或占比", "技术分 商务分 价格分 分值", "技术评分"),
                        of("commercial_score", "商务分", "商务分 商务部分分值",
                                "商务分的分值或占比", "技术分 商务分 价格分 分值", "商务评分"),
                        of("price_score", "价格分", "价格分 价格评分",
                                "价格分的分值、占比及计算方法", "技术分 商务分 价格分 分值", "评标基准价"),
                        of("detailed_scoring", "评分细则", "评分细则 评分项",
                                "各评分项的名称、分值和评分标准", "评分细则 评分标准", "得分 分值"),
                        of("bonus_points", "加分项", "加分项 加分条件",
                                "加分项的条件和分值，如专利、本地化服务、荣誉资质", "加分项 优惠条件"),
                        of("disqualification_clauses", "否决项", "否决投标 废标条款",
                                "否决投标或废标条款，重点关注★号、*号条款", "否决项 废标条件 ★ *", "无效投标"))
                .build();
    }

    public static AgentSpec otherTerms() {
        return AgentSpec.of(AgentNames.OTHER_TERMS, "其他重要信息")
                .description("Contract, payment, delivery, validity, IP, confidentiality and risk terms")
                .fields(
                        of("contract_terms", "合同条款", "合同主要条款",
                                "合同的主要条款和双方责任", "合同条款 合同主要条款"),
                        of("payment_terms", "付款方式", "付款方式 付款条件",
                                "付款方式、付款节点和比例", "付款方式 付款条件 预付款 进度款"),
                        of("delivery_requirements", "交付要求", "交付期限 服务期限",
                                "交付或完成期限、地点和验收要求", "交付期限 完成时间 工期"),
                        of("bid_validity", "投标有效期", "投标有效期",
                                "投标有效期的天数", "投标有效期"),
                        of("intellectual_property", "知识产权", "知识产权条款",
                                "知识产权归属及相关责任", "知识产权 专利权 著作权"),
                        of("confidentiality", "保密要求", "保密条款",
                                "保密义务和保密期限", "保密协议 保密条款"),
                        of("risk_warnings", "风险提示", "违约责任 赔偿",
                                "违约责任、罚款、赔偿等对投标人不利的条款", "违约 责任 赔偿 罚款"))
                .build();
    }
}
