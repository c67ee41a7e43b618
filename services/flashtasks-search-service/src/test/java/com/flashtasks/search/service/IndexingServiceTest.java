package com.flashtasks.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flashtasks.search.common.UnauthorizedException;
import com.flashtasks.search.config.IndexingProperties;
import com.flashtasks.search.ingest.DocumentKind;
import com.flashtasks.search.ingest.DocumentReconciler;
import com.flashtasks.search.ingest.DocumentTypeClassifier;
import com.flashtasks.search.ingest.ReconcileAction;
import com.flashtasks.search.ingest.ReconcileResult;
import com.flashtasks.search.ingest.WebhookAuthenticator;
import com.flashtasks.search.ingest.WebhookEnvelopeDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

@ExtendWith(MockitoExtension.class)
class IndexingServiceTest {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String MEMBER_EVENT =
        "{\"event\":\"databases.main.collections.org_members.documents.m1.update\","
            + "\"document\":{\"$id\":\"m1\",\"email\":\"a@x.com\",\"organizationId\":\"o1\"}}";

    @Mock
    private DocumentReconciler reconciler;

    private IndexingProperties indexingProperties;
    private IndexingService indexingService;

    @BeforeEach
    void setUp() {
        indexingProperties = new IndexingProperties();
        indexingService = new IndexingService(
            new WebhookAuthenticator(indexingProperties),
            new WebhookEnvelopeDecoder(),
            new DocumentTypeClassifier(),
            reconciler
        );
    }

    @Test
    void genericRouteClassifiesMember() throws Exception {
        ReconcileResult merged = new ReconcileResult(
            ReconcileAction.MERGED_INTO_ORGANIZATION,
            "o1",
            "organizations",
            DocumentKind.ORG_MEMBER,
            "m1"
        );
        when(reconciler.reconcile(any(), eq(DocumentKind.ORG_MEMBER))).thenReturn(merged);

        ReconcileResult result = indexingService.index(OBJECT_MAPPER.readTree(MEMBER_EVENT), new HttpHeaders(), IndexRoute.ANY);

        assertThat(result).isSameAs(merged);
    }

    @Test
    void taskRouteAlwaysIndexesAsTask() throws Exception {
        indexingService.index(OBJECT_MAPPER.readTree(MEMBER_EVENT), new HttpHeaders(), IndexRoute.TASK);

        verify(reconciler).reconcile(any(), eq(DocumentKind.TASK));
    }

    @Test
    void organizationRouteKeepsChildKinds() throws Exception {
        indexingService.index(OBJECT_MAPPER.readTree(MEMBER_EVENT), new HttpHeaders(), IndexRoute.ORGANIZATION);
        indexingService.index(
            OBJECT_MAPPER.readTree("{\"document\":{\"$id\":\"o1\",\"title\":\"Acme\"}}"),
            new HttpHeaders(),
            IndexRoute.ORGANIZATION
        );

        verify(reconciler).reconcile(any(), eq(DocumentKind.ORG_MEMBER));
        verify(reconciler).reconcile(any(), eq(DocumentKind.ORGANIZATION));
    }

    @Test
    void rejectsBeforeDecodingWhenSecretMismatches() {
        indexingProperties.setWebhookSecret("s3cret");

        assertThatThrownBy(() -> indexingService.index(
            OBJECT_MAPPER.readTree(MEMBER_EVENT),
            new HttpHeaders(),
            IndexRoute.ANY
        )).isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(reconciler);
    }
}
