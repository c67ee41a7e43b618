package com.flashtasks.search.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flashtasks.search.common.BadRequestException;
import com.flashtasks.search.common.IdGenerator;
import com.flashtasks.search.config.IndexingProperties;
import com.flashtasks.search.opensearch.OpenSearchConflictException;
import com.flashtasks.search.opensearch.OpenSearchGateway;
import com.flashtasks.search.opensearch.OpenSearchProperties;
import com.flashtasks.search.opensearch.StoredDocument;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies create/update/delete events to the store.
 * <p>
 * Tasks and organizations are replaced by identifier. Teams and members have no record of their own: they are
 * merged into (or removed from) the {@code members} / {@code teams} arrays of their parent organization by
 * identifier, leaving every other entry and field untouched.
 * <p>
 * The child read-modify-write is not atomic. Unless {@link IndexingProperties#isOptimisticConcurrency()} is
 * enabled, two concurrent merges into one organization are last-writer-wins and the earlier change can be lost.
 */
@Service
public class DocumentReconciler {
    private static final Logger logger = LoggerFactory.getLogger(DocumentReconciler.class);

    static final String DOC_TYPE = "docType";
    static final String MEMBERS = "members";
    static final String TEAMS = "teams";

    static final List<String> TASK_FIELDS = List.of(
        "title",
        "description",
        "category",
        "status",
        "priority",
        "dueDate",
        "userEmail",
        "$createdAt",
        "$updatedAt",
        "assignee",
        "invites"
    );
    static final List<String> ORGANIZATION_FIELDS = List.of("name", "slug", "description", "$createdAt");
    static final List<String> PARENT_FIELDS = List.of("organizationId", "orgId", "organization_id", "teamOrganizationId");
    // Routing data carried by child payloads, never stored on the embedded entry.
    static final Set<String> CHILD_ROUTING_FIELDS = Set.of(
        "organization",
        DOC_TYPE,
        "documentType",
        "collection",
        "collectionId"
    );
    static final Set<String> CHILD_SYSTEM_FIELDS = Set.of("$id", "$createdAt", "$updatedAt");

    private final OpenSearchGateway openSearchGateway;
    private final OpenSearchProperties openSearchProperties;
    private final IndexingProperties indexingProperties;
    private final ObjectMapper objectMapper;

    public DocumentReconciler(
        OpenSearchGateway openSearchGateway,
        OpenSearchProperties openSearchProperties,
        IndexingProperties indexingProperties,
        ObjectMapper objectMapper
    ) {
        this.openSearchGateway = openSearchGateway;
        this.openSearchProperties = openSearchProperties;
        this.indexingProperties = indexingProperties;
        this.objectMapper = objectMapper;
    }

    public ReconcileResult reconcile(WebhookEnvelope envelope, DocumentKind kind) {
        if (envelope == null || envelope.getDocument() == null) {
            throw new BadRequestException("missing_document", "document payload is required");
        }
        return switch (kind) {
            case TASK -> envelope.isDelete()
                ? delete(kind, openSearchProperties.getTaskIndex(), requireId(envelope))
                : upsertTask(requireId(envelope), envelope.getDocument());
            case ORGANIZATION -> envelope.isDelete()
                ? delete(kind, openSearchProperties.getOrganizationIndex(), requireId(envelope))
                : upsertOrganization(requireId(envelope), envelope.getDocument());
            case TEAM, ORG_MEMBER -> envelope.isDelete()
                ? removeChild(envelope, kind)
                : mergeChild(envelope.getDocument(), kind);
        };
    }

    private ReconcileResult upsertTask(String id, ObjectNode document) {
        ObjectNode body = project(document, TASK_FIELDS);
        body.put(DOC_TYPE, DocumentKind.TASK.value());
        String index = openSearchProperties.getTaskIndex();
        openSearchGateway.indexDocument(index, id, body);
        refreshQuietly(index);
        logger.info("index_upserted kind=task id={} index={}", id, index);
        return ReconcileResult.of(ReconcileAction.UPSERTED, id, index, DocumentKind.TASK);
    }

    private ReconcileResult upsertOrganization(String id, ObjectNode document) {
        String index = openSearchProperties.getOrganizationIndex();
        if (!hasAggregateShape(document)) {
            // Only organization-level fields changed: keep the stored members and teams.
            updateAggregate(id, aggregate -> {
                aggregate.setAll(project(document, ORGANIZATION_FIELDS));
                return true;
            });
            logger.info("index_upserted kind=organization id={} index={} mode=merge", id, index);
            return ReconcileResult.of(ReconcileAction.UPSERTED, id, index, DocumentKind.ORGANIZATION);
        }
        ObjectNode body = project(document, ORGANIZATION_FIELDS);
        body.set(MEMBERS, arrayOrEmpty(document.get(MEMBERS)));
        body.set(TEAMS, arrayOrEmpty(document.get(TEAMS)));
        body.put(DOC_TYPE, DocumentKind.ORGANIZATION.value());
        openSearchGateway.indexDocument(index, id, body);
        refreshQuietly(index);
        logger.info("index_upserted kind=organization id={} index={} mode=replace", id, index);
        return ReconcileResult.of(ReconcileAction.UPSERTED, id, index, DocumentKind.ORGANIZATION);
    }

    private ReconcileResult mergeChild(ObjectNode document, DocumentKind kind) {
        String parentId = requireParentId(document);
        ObjectNode entry = kind == DocumentKind.ORG_MEMBER ? buildMember(document) : buildTeam(document);
        String childId = entry.get("$id").asText();
        String collection = collectionFor(kind);

        updateAggregate(parentId, aggregate -> {
            upsertEntry((ArrayNode) aggregate.get(collection), entry);
            return true;
        });
        String index = openSearchProperties.getOrganizationIndex();
        logger.info(
            "index_merged kind={} child_id={} organization_id={} index={}",
            kind.value(),
            childId,
            parentId,
            index
        );
        return new ReconcileResult(ReconcileAction.MERGED_INTO_ORGANIZATION, parentId, index, kind, childId);
    }

    private ReconcileResult removeChild(WebhookEnvelope envelope, DocumentKind kind) {
        String childId = requireId(envelope);
        String parentId = resolveParentId(envelope.getDocument());
        String index = openSearchProperties.getOrganizationIndex();
        if (parentId == null) {
            return delete(kind, index, childId);
        }
        String collection = collectionFor(kind);
        updateAggregate(parentId, aggregate -> removeEntry((ArrayNode) aggregate.get(collection), childId));
        logger.info(
            "index_child_removed kind={} child_id={} organization_id={} index={}",
            kind.value(),
            childId,
            parentId,
            index
        );
        return new ReconcileResult(ReconcileAction.REMOVED_FROM_ORGANIZATION, parentId, index, kind, childId);
    }

    private ReconcileResult delete(DocumentKind kind, String index, String id) {
        try {
            boolean existed = openSearchGateway.deleteDocument(index, id);
            logger.info("index_deleted kind={} id={} index={} existed={}", kind.value(), id, index, existed);
        } catch (RuntimeException e) {
            logger.warn("index_delete_failed kind={} id={} index={} error={}", kind.value(), id, index, e.getMessage());
        }
        refreshQuietly(index);
        return ReconcileResult.of(ReconcileAction.DELETED, id, index, kind);
    }

    /**
     * Fetches the aggregate (or an empty shell), applies the mutation and writes it back. A mutation returning
     * false writes nothing.
     */
    private void updateAggregate(String organizationId, Predicate<ObjectNode> mutation) {
        String index = openSearchProperties.getOrganizationIndex();
        boolean optimistic = indexingProperties.isOptimisticConcurrency();
        int maxAttempts = optimistic ? Math.max(0, indexingProperties.getMaxConflictRetries()) + 1 : 1;

        for (int attempt = 1; ; attempt++) {
            StoredDocument stored = openSearchGateway.getDocument(index, organizationId);
            ObjectNode aggregate = stored == null ? emptyAggregate() : stored.getSource().deepCopy();
            ensureCollections(aggregate);
            boolean changed = mutation.test(aggregate);
            if (!changed) {
                return;
            }
            aggregate.put(DOC_TYPE, DocumentKind.ORGANIZATION.value());
            try {
                if (!optimistic || (stored != null && !stored.hasVersion())) {
                    openSearchGateway.indexDocument(index, organizationId, aggregate);
                } else if (stored == null) {
                    openSearchGateway.createDocument(index, organizationId, aggregate);
                } else {
                    openSearchGateway.indexDocument(
                        index,
                        organizationId,
                        aggregate,
                        stored.getSeqNo(),
                        stored.getPrimaryTerm()
                    );
                }
                refreshQuietly(index);
                return;
            } catch (OpenSearchConflictException e) {
                if (attempt >= maxAttempts) {
                    logger.warn("aggregate_conflict_exhausted organization_id={} attempts={}", organizationId, attempt);
                    throw e;
                }
                logger.info("aggregate_conflict_retry organization_id={} attempt={}", organizationId, attempt);
            }
        }
    }

    private void refreshQuietly(String index) {
        if (!indexingProperties.isRefreshAfterWrite()) {
            return;
        }
        try {
            openSearchGateway.refresh(index);
        } catch (RuntimeException e) {
            logger.warn("index_refresh_failed index={} error={}", index, e.getMessage());
        }
    }

    private ObjectNode buildMember(ObjectNode document) {
        ObjectNode member = childEntry(document);
        String id = PayloadFields.firstText(document, "$id", "id", "userId");
        if (id == null) {
            String email = PayloadFields.firstText(document, "email");
            id = email != null ? "member_" + email.toLowerCase(Locale.ROOT) : IdGenerator.prefixed("member");
        }
        member.put("$id", id);
        return member;
    }

    private ObjectNode buildTeam(ObjectNode document) {
        ObjectNode team = childEntry(document);
        String id = PayloadFields.firstText(document, "$id", "id");
        team.put("$id", id != null ? id : IdGenerator.prefixed("team"));
        return team;
    }

    /**
     * The payload minus parent references, routing hints and store-generated {@code $} fields other than the
     * identifier and timestamps.
     */
    private ObjectNode childEntry(ObjectNode document) {
        ObjectNode entry = objectMapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> it = document.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            String name = field.getKey();
            if (PARENT_FIELDS.contains(name) || CHILD_ROUTING_FIELDS.contains(name)) {
                continue;
            }
            if (name.startsWith("$") && !CHILD_SYSTEM_FIELDS.contains(name)) {
                continue;
            }
            entry.set(name, field.getValue().deepCopy());
        }
        return entry;
    }

    static void upsertEntry(ArrayNode entries, ObjectNode entry) {
        String id = entry.get("$id").asText();
        for (int i = 0; i < entries.size(); i++) {
            JsonNode existing = entries.get(i);
            if (existing.isObject() && id.equals(PayloadFields.firstText(existing, "$id", "id"))) {
                ObjectNode merged = ((ObjectNode) existing).deepCopy();
                merged.setAll(entry.deepCopy());
                entries.set(i, merged);
                return;
            }
        }
        entries.add(entry.deepCopy());
    }

    static boolean removeEntry(ArrayNode entries, String id) {
        boolean removed = false;
        for (int i = entries.size() - 1; i >= 0; i--) {
            JsonNode existing = entries.get(i);
            if (existing.isObject() && id.equals(PayloadFields.firstText(existing, "$id", "id"))) {
                entries.remove(i);
                removed = true;
            }
        }
        return removed;
    }

    private ObjectNode project(ObjectNode document, List<String> fields) {
        ObjectNode body = objectMapper.createObjectNode();
        for (String field : fields) {
            JsonNode value = document.get(field);
            if (value != null) {
                body.set(field, value.deepCopy());
            }
        }
        return body;
    }

    private ObjectNode emptyAggregate() {
        ObjectNode aggregate = objectMapper.createObjectNode();
        aggregate.put("name", "");
        aggregate.put("slug", "");
        aggregate.put("description", "");
        aggregate.putArray(MEMBERS);
        aggregate.putArray(TEAMS);
        return aggregate;
    }

    private void ensureCollections(ObjectNode aggregate) {
        if (!aggregate.path(MEMBERS).isArray()) {
            aggregate.putArray(MEMBERS);
        }
        if (!aggregate.path(TEAMS).isArray()) {
            aggregate.putArray(TEAMS);
        }
    }

    private JsonNode arrayOrEmpty(JsonNode value) {
        return value != null && value.isArray() ? value.deepCopy() : objectMapper.createArrayNode();
    }

    private boolean hasAggregateShape(ObjectNode document) {
        return PayloadFields.present(document, "name")
            || PayloadFields.nonEmptyArray(document, MEMBERS)
            || PayloadFields.nonEmptyArray(document, TEAMS);
    }

    private String collectionFor(DocumentKind kind) {
        return kind == DocumentKind.TEAM ? TEAMS : MEMBERS;
    }

    private String requireId(WebhookEnvelope envelope) {
        String id = envelope.getDocumentId();
        if (id == null) {
            throw new BadRequestException("missing_document", "document identifier is required");
        }
        return id;
    }

    private String requireParentId(ObjectNode document) {
        String parentId = resolveParentId(document);
        if (parentId == null) {
            throw new BadRequestException("missing_parent_org_id", "parent organization id is required");
        }
        return parentId;
    }

    static String resolveParentId(ObjectNode document) {
        String parentId = PayloadFields.firstText(document, PARENT_FIELDS.toArray(String[]::new));
        if (parentId != null) {
            return parentId;
        }
        JsonNode organization = document.get("organization");
        if (organization == null) {
            return null;
        }
        if (organization.isObject()) {
            return PayloadFields.firstText(organization, "$id", "id");
        }
        String text = organization.isTextual() ? organization.asText().trim() : "";
        return text.isEmpty() ? null : text;
    }
}
