package world.willfrog.sentinel.triage.tool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.common.pojo.triage.Alert;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.entity.KbDoc;
import world.willfrog.sentinel.triage.mapper.KbDocMapper;
import world.willfrog.sentinel.triage.model.KnowledgeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * 按告警特征检索知识库，返回最多 3 条带锚点的引用。检索失败时返回空列表。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KnowledgeBaseTool implements TriageTool<List<KnowledgeRef>> {

    public static final String NAME = "kbLookup";

    static final int SEARCH_LIMIT = 5;
    static final int MAX_REFS = 3;
    static final int EXTRACT_MAX_LENGTH = 200;

    private final KbDocMapper kbDocMapper;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<KnowledgeRef> run(AgentContext context) {
        List<String> keywords = keywords(context.getAlert());
        List<KbDoc> docs = search(keywords);
        List<KnowledgeRef> refs = new ArrayList<>();
        for (KbDoc doc : docs) {
            if (refs.size() >= MAX_REFS) {
                break;
            }
            refs.add(KnowledgeRef.builder()
                    .docId(doc.getId())
                    .title(doc.getTitle())
                    .anchor(StringUtils.defaultIfBlank(doc.getAnchor(), "#" + doc.getId()))
                    .extract(extract(doc.getContentText()))
                    .build());
        }
        return refs;
    }

    @Override
    public void contribute(AgentContext context, List<KnowledgeRef> data) {
        context.setKnowledgeRefs(data);
    }

    List<String> keywords(Alert alert) {
        List<String> keywords = new ArrayList<>();
        if (alert != null && "high".equalsIgnoreCase(alert.getSeverity())) {
            keywords.add("fraud");
            keywords.add("urgent");
        }
        if (alert != null && alert.getTransaction() != null) {
            keywords.add("transaction");
            keywords.add("payment");
        }
        keywords.add("dispute");
        keywords.add("chargeback");
        keywords.add("customer");
        return keywords;
    }

    private List<KbDoc> search(List<String> keywords) {
        try {
            List<KbDoc> docs = kbDocMapper.searchByKeywords(keywords, SEARCH_LIMIT);
            return docs == null ? List.of() : docs;
        } catch (RuntimeException e) {
            log.warn("Knowledge base search failed, returning no refs: keywords={}, error={}", keywords, e.getMessage());
            return List.of();
        }
    }

    static String extract(String content) {
        if (StringUtils.isBlank(content)) {
            return "";
        }
        String cleaned = StringUtils.normalizeSpace(content);
        if (cleaned.length() <= EXTRACT_MAX_LENGTH) {
            return cleaned;
        }
        return cleaned.substring(0, EXTRACT_MAX_LENGTH) + "...";
    }
}
