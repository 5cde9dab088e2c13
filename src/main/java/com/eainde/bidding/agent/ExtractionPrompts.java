package com.eainde.bidding.agent;

import com.eainde.bidding.model.RerankedResult;
import com.eainde.bidding.provider.JsonSchemaConverter;
import dev.langchain4j.model.chat.request.json.JsonSchema;

import java.util.List;

/**
 * Prompt and response schema for single-field extraction.
 */
final class ExtractionPrompts {

    private ExtractionPrompts() {}

    static final JsonSchema FIELD_SCHEMA = JsonSchemaConverter.parse("field_extraction", """
            {
              "type": "object",
              "properties": {
                "found":       { "type": "boolean", "description": "证据中是否包含该字段的信息" },
                "value":       { "type": ["string", "null"], "description": "提取的字段值" },
                "evidence_id": { "type": ["integer", "null"], "description": "值所在证据片段的编号" },
                "quote":       { "type": ["string", "null"], "description": "证据片段中的原文，逐字摘录" },
                "confidence":  { "type": "number", "description": "置信度，0 到 1" },
                "notes":       { "type": ["string", "null"], "description": "补充说明" }
              },
              "required": ["found", "value", "evidence_id", "quote", "confidence", "notes"]
            }
            """);

    static String fieldPrompt(AgentSpec agent, FieldSpec field, List<RerankedResult> evidence) {
        StringBuilder sb = new StringBuilder();
        sb.append("你是一个专业的招投标文件分析专家，负责提取“").append(agent.category()).append("”类信息。\n");
        sb.append("请仅根据下面提供的证据片段提取指定字段，不要使用证据以外的知识。\n\n");
        sb.append("字段标识：").append(field.name()).append('\n');
        sb.append("字段名称：").append(field.label()).append('\n');
        if (!field.instruction().isBlank()) {
            sb.append("提取要求：").append(field.instruction()).append('\n');
        }
        sb.append("\n证据片段：\n");
        for (int i = 0; i < evidence.size(); i++) {
            sb.append("<evidence id=\"").append(i + 1).append("\">\n")
                    .append(evidence.get(i).hit().text())
                    .append("\n</evidence>\n");
        }
        sb.append("""

                输出要求：
                1. 找到信息时 found 为 true，value 为提取的值，evidence_id 为值所在证据片段的编号，quote 为该片段中的原文摘录（逐字复制）；
                2. 证据中没有该信息时 found 为 false，value、evidence_id、quote 为 null；
                3. 特别关注带有“★”、“*”、“否决”、“废标”等标记的条款；
                4. confidence 表示对结果的把握程度。
                """);
        return sb.toString();
    }
}
