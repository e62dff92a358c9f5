package io.github.cyfko.mqlfilter.core.parsing;

import io.github.cyfko.mqlfilter.core.api.MqlOperator;
import io.github.cyfko.mqlfilter.core.api.PredicateNode;
import io.github.cyfko.mqlfilter.core.config.CompileOptions;
import io.github.cyfko.mqlfilter.core.config.CompilePolicy;
import io.github.cyfko.mqlfilter.core.exception.MqlErrorCode;
import io.github.cyfko.mqlfilter.core.exception.MqlFieldException;
import io.github.cyfko.mqlfilter.core.exception.MqlFieldPermissionException;
import io.github.cyfko.mqlfilter.core.exception.MqlTooComplexException;
import io.github.cyfko.mqlfilter.core.exception.UnknownFieldException;
import io.github.cyfko.mqlfilter.core.model.AttributePath;
import io.github.cyfko.mqlfilter.core.spi.FieldDescriptor;
import io.github.cyfko.mqlfilter.core.spi.MessageFormatter;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;
import io.github.cyfko.mqlfilter.core.utils.PathUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Stack machine compiling one filter document into a {@link PredicateNode}.
 * <p>
 * The document is walked iteratively with an explicit work stack, so adversarial nesting
 * cannot overflow the call stack, and the work stack size doubles as the complexity
 * measure bounded by {@link CompilePolicy#complexityLimit()}.
 * </p>
 *
 * <h2>State</h2>
 * <ul>
 *   <li><strong>work stack</strong>: pending document fragments and pop sentinels</li>
 *   <li><strong>open path</strong>: field names entered so far, as written by the user and after
 *   key translation; both seeded with the root model's name</li>
 *   <li><strong>boundaries</strong>: depths of the open path at which existential scopes were
 *   opened; seeded with the root</li>
 *   <li><strong>frames</strong>: predicate tree levels under construction; seeded with an AND frame</li>
 * </ul>
 *
 * <h2>Relation Boundaries</h2>
 * <p>
 * A field path crossing a relation that is not already open gets rewritten into an
 * {@code $elemMatch} on that relation, which opens an {@link PredicateNode.Exists} scope. Two
 * sibling keys crossing the same to-many relation therefore produce two independent scopes,
 * while an explicit {@code $elemMatch} keeps every condition in one scope:
 * </p>
 * <pre>{@code
 * {"tracks.name": "A", "tracks.composer": "B"}
 *   -> And[Exists(tracks, name = A), Exists(tracks, composer = B)]
 *
 * {"tracks": {"$elemMatch": {"name": "A", "composer": "B"}}}
 *   -> Exists(tracks, And[name = A, composer = B])
 * }</pre>
 *
 * <p>
 * Instances are single-use: create one per compile call.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class BoundaryManager {

    private static final Logger log = Logger.getLogger(BoundaryManager.class.getName());

    static final String TOO_COMPLEX_MESSAGE = "This query is too complex.";
    static final String LOGICAL_LIST_MESSAGE = "%s value must be a list of filter documents.";
    static final String NOT_DOCUMENT_MESSAGE = "$not value must be a filter document.";
    static final String ELEM_MATCH_DOCUMENT_MESSAGE = "$elemMatch value must be a filter document.";
    static final String ELEM_MATCH_MESSAGE = "$elemMatch not applied to subobject.";
    static final String INVALID_OP_MESSAGE = "Invalid operator.";
    static final String RELATION_EQUALITY_MESSAGE = "Relationships can't be checked for equality.";
    static final String RELATION_PRIMITIVE_MESSAGE = "Relationships can't be compared to primitive values.";
    static final String ATTR_COMP_MESSAGE = "Attempts at comparing an attribute to an object aren't valid.";
    static final String EMPTY_COMP_MESSAGE = "Fields can't be compared to empty objects.";
    static final String PERMISSION_MESSAGE = "Attempt made to query a field without proper permission.";
    static final String UNKNOWN_KEY_MESSAGE = "Unknown field '%s'.";

    private enum Sentinel {
        POP_PATH,
        POP_BOUNDARY,
        POP_FRAME
    }

    private final SchemaModel root;
    private final CompileOptions options;
    private final MessageFormatter messageFormatter;
    private final PathResolver pathResolver;
    private final OperatorEvaluator operatorEvaluator;

    private final Deque<Object> work = new ArrayDeque<>();
    private final List<String> externalPath = new ArrayList<>();
    private final List<String> internalPath = new ArrayList<>();
    private final Deque<Integer> boundaries = new ArrayDeque<>();
    private final Deque<ScopeFrame> frames = new ArrayDeque<>();
    private boolean used;

    /**
     * @param root    root model the document filters
     * @param options compile options
     */
    public BoundaryManager(SchemaModel root, CompileOptions options) {
        this.root = Objects.requireNonNull(root, "root");
        this.options = Objects.requireNonNull(options, "options");
        this.messageFormatter = options.getMessageFormatter();
        this.pathResolver = new PathResolver(messageFormatter);
        this.operatorEvaluator = new OperatorEvaluator(messageFormatter);
    }

    /**
     * Compiles the document.
     *
     * @param document filter document; {@code null} yields the vacuous true
     * @return the compiled predicate
     * @throws io.github.cyfko.mqlfilter.core.exception.InvalidMqlException on the first invalid fragment
     * @throws IllegalStateException if this instance was already used
     */
    public PredicateNode compile(Map<String, ?> document) {
        if (used) {
            throw new IllegalStateException("BoundaryManager instances are single-use");
        }
        used = true;
        if (document == null) {
            return PredicateNode.alwaysTrue();
        }

        externalPath.add(root.name());
        internalPath.add(root.name());
        boundaries.push(externalPath.size());
        frames.push(ScopeFrame.of(ScopeFrame.Combinator.AND));
        work.push(document);

        CompilePolicy policy = options.getPolicy();
        while (!work.isEmpty()) {
            if (policy.isLimited() && work.size() > policy.complexityLimit()) {
                throw new MqlTooComplexException(messageFormatter.format(TOO_COMPLEX_MESSAGE), policy.complexityLimit());
            }
            Object item = work.pop();
            if (item instanceof Sentinel sentinel) {
                unwind(sentinel);
            } else {
                process((Map<?, ?>) item);
            }
        }
        return PredicateNode.and(frames.peek().accumulated());
    }

    // ==================== Dispatch ====================

    private void unwind(Sentinel sentinel) {
        switch (sentinel) {
            case POP_PATH -> {
                externalPath.remove(externalPath.size() - 1);
                internalPath.remove(internalPath.size() - 1);
            }
            case POP_BOUNDARY -> boundaries.pop();
            case POP_FRAME -> {
                ScopeFrame closed = frames.pop();
                frames.peek().add(closed.close());
            }
        }
    }

    private void process(Map<?, ?> item) {
        if (item.isEmpty()) {
            return;
        }
        if (item.size() > 1) {
            openFrame(ScopeFrame.Combinator.AND);
            pushEntriesInOrder(item);
            return;
        }

        Map.Entry<?, ?> entry = item.entrySet().iterator().next();
        String key = String.valueOf(entry.getKey());
        Object value = entry.getValue();

        if (!MqlOperator.isOperatorKey(key)) {
            processField(key, value, item);
            return;
        }

        MqlOperator op = MqlOperator.fromToken(key);
        if (op == null) {
            throw fieldError(openDataKey(), value, key, INVALID_OP_MESSAGE, MqlErrorCode.INVALID_OP);
        }
        switch (op) {
            case AND -> processLogical(ScopeFrame.Combinator.AND, op, value);
            case OR -> processLogical(ScopeFrame.Combinator.OR, op, value);
            case NOR -> {
                requireDocumentList(op, value);
                openFrame(ScopeFrame.Combinator.NOT);
                work.push(Collections.singletonMap(MqlOperator.OR.getToken(), value));
            }
            case NOT -> {
                if (!(value instanceof Map)) {
                    throw fieldError(openDataKey(), value, key, NOT_DOCUMENT_MESSAGE, MqlErrorCode.INVALID_LOGICAL_COMP);
                }
                openFrame(ScopeFrame.Combinator.NOT);
                work.push(value);
            }
            case ELEM_MATCH -> processElemMatch(value);
            default -> processOperator(op, value);
        }
    }

    // ==================== Logical operators ====================

    private void processLogical(ScopeFrame.Combinator combinator, MqlOperator op, Object value) {
        List<?> documents = requireDocumentList(op, value);
        openFrame(combinator);
        for (int i = documents.size() - 1; i >= 0; i--) {
            work.push(documents.get(i));
        }
    }

    private List<?> requireDocumentList(MqlOperator op, Object value) {
        if (value instanceof List<?> documents && documents.stream().allMatch(Map.class::isInstance)) {
            return documents;
        }
        throw new MqlFieldException(openDataKey(), value, op.getToken(),
                messageFormatter.format(LOGICAL_LIST_MESSAGE, op.getToken()), MqlErrorCode.INVALID_LOGICAL_COMP);
    }

    // ==================== Existential scopes ====================

    private void processElemMatch(Object value) {
        String dataKey = openDataKey();
        String token = MqlOperator.ELEM_MATCH.getToken();
        if (!(value instanceof Map)) {
            throw fieldError(dataKey, value, token, ELEM_MATCH_DOCUMENT_MESSAGE, MqlErrorCode.INVALID_ELEM_MATCH);
        }
        // nothing entered since the innermost scope: there is no new relation to open
        if (externalPath.size() <= boundaries.peek()) {
            throw fieldError(dataKey, value, token, ELEM_MATCH_MESSAGE, MqlErrorCode.INVALID_ELEM_MATCH);
        }
        List<FieldDescriptor> chain = pathResolver.resolve(root, openInternalPath(), dataKey, value);
        if (chain.isEmpty() || !(chain.get(chain.size() - 1) instanceof FieldDescriptor.Relation relation)) {
            throw fieldError(dataKey, value, token, ELEM_MATCH_MESSAGE, MqlErrorCode.INVALID_ELEM_MATCH);
        }

        List<PredicateNode> conditions = nestedConditions();
        frames.push(ScopeFrame.exists(relation, conditions));
        boundaries.push(externalPath.size());
        log.finest(() -> String.format("Opened %s scope on '%s' with %d nested condition(s)",
                relation.cardinality(), PathUtils.stripIndexSegments(openInternalPath()), conditions.size()));

        work.push(Sentinel.POP_BOUNDARY);
        work.push(Sentinel.POP_FRAME);
        work.push(value);
    }

    /**
     * Mandatory predicates for the relation at the end of the open path. Called once per opened scope.
     */
    private List<PredicateNode> nestedConditions() {
        List<PredicateNode> supplied = options.getNestedConditions()
                .conditionsFor(PathUtils.stripIndexSegments(openInternalPath()));
        return supplied == null ? List.of() : new ArrayList<>(supplied);
    }

    // ==================== Field operators ====================

    private void processOperator(MqlOperator op, Object value) {
        String dataKey = openDataKey();
        if (externalPath.size() == 1) {
            throw fieldError(dataKey, value, op.getToken(), RELATION_EQUALITY_MESSAGE, MqlErrorCode.INVALID_RELATION_COMP);
        }
        List<FieldDescriptor> chain = pathResolver.resolve(root, openInternalPath(), dataKey, value);
        FieldDescriptor leaf = chain.get(chain.size() - 1);

        if (leaf instanceof FieldDescriptor.Relation && op != MqlOperator.EXISTS) {
            throw fieldError(dataKey, value, op.getToken(), RELATION_EQUALITY_MESSAGE, MqlErrorCode.INVALID_RELATION_COMP);
        }
        // relation $exists is unconstrained: nested conditions only seed $elemMatch scopes
        frames.peek().add(operatorEvaluator.evaluate(op, leaf, value, dataKey));
    }

    // ==================== Plain field keys ====================

    private void processField(String key, Object value, Map<?, ?> item) {
        List<String> keySegments = PathUtils.split(key);
        String externalFull = joinWith(externalPath, keySegments);

        String translated = options.getKeyTranslator().translate(externalFull);
        if (translated == null) {
            throw new UnknownFieldException(externalFull, value,
                    messageFormatter.format(UNKNOWN_KEY_MESSAGE, externalFull));
        }
        List<String> internalKeySegments = PathUtils.tail(translated, keySegments.size());
        if (internalKeySegments.size() != keySegments.size()) {
            throw new UnknownFieldException(externalFull, value,
                    messageFormatter.format(UNKNOWN_KEY_MESSAGE, externalFull));
        }
        String internalFull = joinWith(internalPath, internalKeySegments);

        if (!options.getWhitelist().isAllowed(PathUtils.stripIndexSegments(internalFull))) {
            throw new MqlFieldPermissionException(externalFull, value, messageFormatter.format(PERMISSION_MESSAGE));
        }
        if (externalPath.size() > boundaries.peek()) {
            throw fieldError(openDataKey(), item, MqlOperator.EQ.getToken(), ATTR_COMP_MESSAGE, MqlErrorCode.INVALID_ATTR_COMP);
        }

        AttributePath target = pathResolver.resolvePath(root, externalFull, internalFull, value);
        List<Integer> crossings = target.relationCrossings();
        List<Integer> openCrossings = boundaryPath().relationCrossings();

        if (crossings.size() == openCrossings.size()) {
            enterPath(key, PathUtils.join(internalKeySegments));
            work.push(value instanceof Map ? value : Collections.singletonMap(MqlOperator.EQ.getToken(), value));
            return;
        }
        if (crossings.size() < openCrossings.size()) {
            throw fieldError(externalFull, item, MqlOperator.EQ.getToken(), ATTR_COMP_MESSAGE, MqlErrorCode.INVALID_ATTR_COMP);
        }

        // the next relation not opened yet becomes the open path, the rest is matched inside its scope
        int next = crossings.get(openCrossings.size());
        int prior = openCrossings.isEmpty() ? -1 : openCrossings.get(openCrossings.size() - 1);
        List<String> externalSegments = target.externalSegments();
        List<String> internalSegments = target.internalSegments();
        String subAttr = PathUtils.join(externalSegments.subList(next + 1, externalSegments.size()));
        enterPath(PathUtils.join(externalSegments.subList(prior + 1, next + 1)),
                PathUtils.join(internalSegments.subList(prior + 1, next + 1)));

        boolean lastCrossing = next == crossings.get(crossings.size() - 1);
        if (lastCrossing && value instanceof Map<?, ?> document) {
            if (!subAttr.isEmpty()) {
                work.push(elemMatch(subAttr, value));
            } else if (document.isEmpty()) {
                throw fieldError(openDataKey(), value, null, EMPTY_COMP_MESSAGE, MqlErrorCode.INVALID_EMPTY_COMP);
            } else {
                openFrame(ScopeFrame.Combinator.AND);
                List<Map.Entry<?, ?>> entries = new ArrayList<>(document.entrySet());
                for (int i = entries.size() - 1; i >= 0; i--) {
                    String subKey = String.valueOf(entries.get(i).getKey());
                    Object subValue = entries.get(i).getValue();
                    if (MqlOperator.ELEM_MATCH.getToken().equals(subKey) || MqlOperator.EXISTS.getToken().equals(subKey)) {
                        work.push(Collections.singletonMap(subKey, subValue));
                    } else {
                        work.push(elemMatch(subKey, subValue));
                    }
                }
            }
        } else if (lastCrossing && subAttr.isEmpty()) {
            throw fieldError(openDataKey(), value, null, RELATION_PRIMITIVE_MESSAGE, MqlErrorCode.INVALID_RELATION_COMP);
        } else {
            work.push(elemMatch(subAttr, value));
        }
    }

    // ==================== Helpers ====================

    private void openFrame(ScopeFrame.Combinator combinator) {
        frames.push(ScopeFrame.of(combinator));
        work.push(Sentinel.POP_FRAME);
    }

    private void pushEntriesInOrder(Map<?, ?> item) {
        List<Map.Entry<?, ?>> entries = new ArrayList<>(item.entrySet());
        for (int i = entries.size() - 1; i >= 0; i--) {
            work.push(Collections.singletonMap(String.valueOf(entries.get(i).getKey()), entries.get(i).getValue()));
        }
    }

    private void enterPath(String externalName, String internalName) {
        externalPath.add(externalName);
        internalPath.add(internalName);
        work.push(Sentinel.POP_PATH);
    }

    private static Map<String, Object> elemMatch(String subAttr, Object value) {
        return Collections.singletonMap(MqlOperator.ELEM_MATCH.getToken(), Collections.singletonMap(subAttr, value));
    }

    private AttributePath boundaryPath() {
        int depth = boundaries.peek();
        String external = PathUtils.join(externalPath.subList(1, depth));
        String internal = PathUtils.join(internalPath.subList(1, depth));
        return pathResolver.resolvePath(root, external, internal, null);
    }

    private String openDataKey() {
        return PathUtils.join(externalPath.subList(1, externalPath.size()));
    }

    private String openInternalPath() {
        return PathUtils.join(internalPath.subList(1, internalPath.size()));
    }

    private static String joinWith(List<String> openPath, List<String> keySegments) {
        List<String> segments = new ArrayList<>(openPath.subList(1, openPath.size()));
        segments.addAll(keySegments);
        return PathUtils.join(segments);
    }

    private MqlFieldException fieldError(String dataKey, Object filter, String op, String template, MqlErrorCode code) {
        return new MqlFieldException(dataKey, filter, op, messageFormatter.format(template), code);
    }
}
