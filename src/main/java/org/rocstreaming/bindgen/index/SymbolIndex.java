package org.rocstreaming.bindgen.index;

import org.rocstreaming.bindgen.model.DocBlock;
import org.rocstreaming.bindgen.model.DocItem;
import org.rocstreaming.bindgen.model.DocRef;
import org.rocstreaming.bindgen.model.Documented;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Global table from raw reference token to its classification.
 *
 * <p>The index is filled by visiting every documentation tree of the API before any rendering
 * starts, since a comment may point at a definition declared later. Each distinct token is
 * classified once by the {@link ReferenceResolver}; later occurrences reuse the cached result,
 * so identical tokens always render identically.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SymbolIndex index = new SymbolIndex(resolver);
 * index.visit(enumDefinition);
 * index.visit(enumValue);
 * Map<String, DocRef> refs = index.resolved();
 * }</pre>
 *
 * <p>Not thread-safe; built by a single thread during assembly.
 */
public final class SymbolIndex {

    private static final Logger log = LoggerFactory.getLogger(SymbolIndex.class);

    private final ReferenceResolver resolver;
    private final Map<String, DocRef> resolved = new LinkedHashMap<>();
    private final Set<String> unresolved = new LinkedHashSet<>();

    public SymbolIndex(ReferenceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Resolves a token, classifying it on first encounter only.
     *
     * @param token the raw text of a reference or inline code item
     * @return the cached reference, or empty if the token is unresolved
     */
    public Optional<DocRef> resolve(String token) {
        DocRef cached = resolved.get(token);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (unresolved.contains(token)) {
            return Optional.empty();
        }

        Optional<DocRef> ref = resolver.resolve(token);
        if (ref.isPresent()) {
            log.debug("Resolved reference {} as {}", token, ref.get().kind());
            resolved.put(token, ref.get());
        } else {
            log.warn("Unresolved reference: {}, it will be rendered as plain code", token);
            unresolved.add(token);
        }
        return ref;
    }

    /**
     * Indexes every reference in the documentation of an element, including nested lists.
     *
     * @param element the element whose comment should be indexed
     */
    public void visit(Documented element) {
        for (DocBlock block : element.doc().blocks()) {
            visitBlock(block);
        }
    }

    private void visitBlock(DocBlock block) {
        for (DocItem item : block.items()) {
            if (item.isReference()) {
                if (item.text() != null) {
                    resolve(item.text());
                }
            } else {
                for (DocBlock child : item.childBlocks()) {
                    visitBlock(child);
                }
            }
        }
    }

    /**
     * Returns the resolved tokens in first-encounter order.
     */
    public Map<String, DocRef> resolved() {
        return Collections.unmodifiableMap(resolved);
    }

    /**
     * Returns the unresolved tokens in first-encounter order.
     */
    public Set<String> unresolved() {
        return Collections.unmodifiableSet(unresolved);
    }
}
