package com.eainde.bidding.support;

import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.model.Document;

import java.time.Duration;

public final class TenderFixtures {

    private TenderFixtures() {}

    public static final String BUDGET_SENTENCE = "预算金额：人民币500万元整";

    public static Document sampleTender() {
        StringBuilder sb = new StringBuilder();
        sb.append("第一章 招标公告\n");
        sb.append("项目名称：智慧城市综合管理平台建设项目\n");
        sb.append("招标编号：ZB-2024-0815\n");
        sb.append(BUDGET_SENTENCE).append("。\n");
        sb.append("投标截止时间：2024年9月20日上午9时30分\n");
        filler(sb, "投标人应仔细阅读招标文件的全部内容，并按照要求编制和递交投标文件。", 30);
        sb.append("第二章 评标办法\n");
        sb.append("评标办法：综合评分法。技术分60分，商务分20分，价格分20分。\n");
        filler(sb, "评标委员会依据本章规定对通过初步评审的投标文件进行详细评审。", 30);
        sb.append("第三章 合同条款\n");
        sb.append("付款方式：合同签订后支付30%预付款，验收合格后支付剩余70%\n");
        filler(sb, "供应商应按照合同约定履行义务，接受采购人的监督和检查。", 30);
        return Document.of("tender-001", "智慧城市招标文件.txt", sb.toString());
    }

    public static Document otherTender() {
        StringBuilder sb = new StringBuilder();
        sb.append("项目名称：医院信息化改造项目\n");
        sb.append("预算金额：人民币120万元\n");
        filler(sb, "本项目采用公开招标方式，欢迎合格的供应商参加投标。", 10);
        return Document.of("tender-002", "医院招标文件.txt", sb.toString());
    }

    /** Defaults with near-zero retry delays so failing calls do not slow tests down. */
    public static PipelineProperties.Builder fastProperties() {
        return PipelineProperties.builder()
                .perCallMaxRetries(1)
                .retryBaseDelay(Duration.ofMillis(1))
                .retryMaxDelay(Duration.ofMillis(5))
                .cancellationGrace(Duration.ofSeconds(1));
    }

    private static void filler(StringBuilder sb, String sentence, int times) {
        for (int i = 0; i < times; i++) {
            sb.append(sentence);
            if (i % 5 == 4) {
                sb.append('\n');
            }
        }
        sb.append('\n');
    }
}
