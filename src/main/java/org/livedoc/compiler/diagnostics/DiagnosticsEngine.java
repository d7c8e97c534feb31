package org.livedoc.compiler.diagnostics;

import org.livedoc.compiler.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The shared error sink. Expansion appends to it and never throws, so a caller sees every
 * problem of an edit in one report.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<LiveError> errors = new ArrayList<>();

    public void report(LiveError error) {
        LOG.debug("Recorded {}", error);
        errors.add(error);
    }

    public void report(LiveErrorKind kind, Class<?> origin, Span span, String message) {
        report(LiveError.of(kind, origin, span, message));
    }

    public List<LiveError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    public List<LiveError> errorsOfKind(LiveErrorKind kind) {
        return errors.stream().filter(e -> e.kind() == kind).collect(Collectors.toList());
    }

    /**
     * Renders every recorded error with the given renderer, typically
     * {@code registry::liveErrorToLiveFileError}.
     */
    public List<LiveFileError> render(Function<LiveError, LiveFileError> renderer) {
        return errors.stream().map(renderer).collect(Collectors.toList());
    }

    public String summary() {
        return errors.stream().map(LiveError::message).collect(Collectors.joining("\n"));
    }

    public void clear() {
        errors.clear();
    }
}
