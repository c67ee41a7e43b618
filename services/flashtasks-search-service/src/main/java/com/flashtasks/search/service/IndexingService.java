package com.flashtasks.search.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flashtasks.search.ingest.DocumentKind;
import com.flashtasks.search.ingest.DocumentReconciler;
import com.flashtasks.search.ingest.DocumentTypeClassifier;
import com.flashtasks.search.ingest.ReconcileResult;
import com.flashtasks.search.ingest.WebhookAuthenticator;
import com.flashtasks.search.ingest.WebhookEnvelope;
import com.flashtasks.search.ingest.WebhookEnvelopeDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

@Service
public class IndexingService {
    private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

    private final WebhookAuthenticator authenticator;
    private final WebhookEnvelopeDecoder decoder;
    private final DocumentTypeClassifier classifier;
    private final DocumentReconciler reconciler;

    public IndexingService(
        WebhookAuthenticator authenticator,
        WebhookEnvelopeDecoder decoder,
        DocumentTypeClassifier classifier,
        DocumentReconciler reconciler
    ) {
        this.authenticator = authenticator;
        this.decoder = decoder;
        this.classifier = classifier;
        this.reconciler = reconciler;
    }

    public ReconcileResult index(JsonNode body, HttpHeaders headers, IndexRoute route) {
        authenticator.verify(headers);
        WebhookEnvelope envelope = decoder.decode(body, headers);
        DocumentKind kind = route.narrow(classifier.classify(envelope.getDocument(), envelope.getHints()));
        logger.debug(
            "webhook_decoded route={} kind={} event={} descriptor={}",
            route,
            kind.value(),
            envelope.getEventKind(),
            envelope.getDescriptor()
        );
        return reconciler.reconcile(envelope, kind);
    }
}
