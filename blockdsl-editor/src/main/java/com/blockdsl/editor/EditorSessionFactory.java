package com.blockdsl.editor;

import com.blockdsl.api.DslChangeListener;
import com.blockdsl.api.IDslParser;
import com.blockdsl.api.MethodSchemaProvider;
import com.blockdsl.api.model.ActionSignature;
import com.blockdsl.api.model.EditorMeta;
import com.blockdsl.api.model.EditorMode;
import com.blockdsl.api.model.RuleSignature;
import com.blockdsl.api.model.SessionState;
import com.blockdsl.compiler.DslParser;
import com.blockdsl.infra.config.EditorConfig;
import com.blockdsl.infra.schema.CachingMethodSchemaProvider;
import com.blockdsl.infra.store.DefinitionStore;
import com.blockdsl.infra.store.DslDefinition;
import com.google.common.util.concurrent.MoreExecutors;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Opens editor sessions on stored definitions and writes their generated text
 * back.
 *
 * <p>Header metadata combines the stored record with the DSL header: the
 * record's name, priority and entity type win, the trigger, description and
 * parameters come from the text. The schema provider is wrapped in a
 * {@link CachingMethodSchemaProvider} when caching is enabled, so every
 * session opened by one factory shares the cache.
 */
public class EditorSessionFactory {

    private static final Logger logger = Logger.getLogger(EditorSessionFactory.class.getName());

    private final DefinitionStore store;
    private final MethodSchemaProvider schemaProvider;
    private final EditorConfig config;
    private final IDslParser headerParser;
    private final Executor callbackExecutor;
    private final Tracer tracer;

    public EditorSessionFactory(DefinitionStore store, MethodSchemaProvider schemaProvider, EditorConfig config) {
        this(store, schemaProvider, config, MoreExecutors.directExecutor(),
            OpenTelemetry.noop().getTracer("blockdsl-editor"));
    }

    public EditorSessionFactory(DefinitionStore store, MethodSchemaProvider schemaProvider, EditorConfig config,
                                Executor callbackExecutor, Tracer tracer) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.schemaProvider = CachingMethodSchemaProvider.wrap(
            Objects.requireNonNull(schemaProvider, "schemaProvider"), config);
        this.callbackExecutor = callbackExecutor;
        this.tracer = tracer;
        this.headerParser = new DslParser(tracer);
    }

    /**
     * Opens a session on the stored definition with this name.
     *
     * @return the open session, or empty when no such definition exists
     */
    public Optional<EditorSession> open(String name, DslChangeListener listener) {
        Optional<DslDefinition> definition = store.find(name);
        if (definition.isEmpty()) {
            logger.warning("No definition named " + name);
        }
        return definition.map(found -> open(found, listener));
    }

    public EditorSession open(DslDefinition definition, DslChangeListener listener) {
        EditorSession session = EditorSession.builder(definition.mode())
            .meta(metaOf(definition))
            .listener(listener == null ? DslChangeListener.NONE : listener)
            .schemaProvider(schemaProvider)
            .callbackExecutor(callbackExecutor)
            .tracer(tracer)
            .config(config)
            .build();
        session.open(definition.dslText());
        logger.fine("Opened " + definition.mode() + " session on " + definition.name());
        return session;
    }

    EditorMeta metaOf(DslDefinition definition) {
        String text = definition.dslText();
        if (definition.mode() == EditorMode.ACTION) {
            Optional<ActionSignature> header = headerParser.parseActionSignature(text);
            String entityType = definition.entityType() != null
                ? definition.entityType()
                : header.map(ActionSignature::entityType).orElse(null);
            return EditorMeta.forAction(
                definition.name(),
                entityType,
                header.map(ActionSignature::description).orElse(null),
                header.map(ActionSignature::parameters).orElse(null));
        }
        Optional<RuleSignature> header = headerParser.parseRuleSignature(text);
        Integer priority = definition.priority() != null
            ? definition.priority()
            : header.map(RuleSignature::priority).orElse(null);
        return EditorMeta.forRule(
            definition.name(),
            priority,
            header.map(RuleSignature::trigger).orElse(null));
    }

    /**
     * Stores the session's generated text verbatim under the definition name.
     *
     * @return the updated definition, or empty when the session is not open or
     *         the definition no longer exists
     */
    public Optional<DslDefinition> commit(String name, EditorSession session) {
        if (session.state() != SessionState.SYNCED && session.state() != SessionState.DIRTY) {
            logger.warning("Refusing to commit " + name + " from a session in state " + session.state());
            return Optional.empty();
        }
        Optional<DslDefinition> saved = store.saveDsl(name, session.generatedSource());
        if (saved.isEmpty()) {
            logger.warning("Cannot commit " + name + ": definition no longer exists");
        }
        return saved;
    }
}
