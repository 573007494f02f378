package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.ConnectionKind;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.DiagramSnapshot;
import com.processlayout.reposition.model.ElementKind;
import com.processlayout.reposition.model.Point;
import com.processlayout.reposition.structure.BoundaryAttachment;
import com.processlayout.reposition.structure.ContainerNode;

/**
 * Topology driven repositioning of an existing process diagram.
 *
 * The engine only moves and resizes existing shapes and reroutes existing
 * connections; it never creates, deletes or reparents anything. A run goes
 * through these phases:
 *
 * 1. CONTAINERS: every container, deepest first, gets its own pass:
 *    extract the flow graph, detect back-edges, layer, detect gateway
 *    patterns, compute positions, resolve overlaps, place boundary events
 *    and exception chains, fit lanes, place event sub-processes, write
 *    back, and finally shrink-wrap the container around its content.
 * 2. STACK: top-level pools are stacked vertically.
 * 3. ARTIFACTS: annotations and data objects follow their nodes.
 * 4. ROUTE: forward edges, back-edges, exception edges, associations,
 *    then edges between containers.
 * 5. LABELS: external labels follow their shapes and paths.
 *
 * Invalid options are rejected before anything is written. Inconsistent
 * diagrams (dangling edges, vanished nodes, unknown pinned ids) are
 * tolerated and simply skipped.
 */
public class RepositionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RepositionEngine.class);

    private static final double MOVE_EPSILON = 0.5;

    private final FlowGraphExtractor extractor = new FlowGraphExtractor();
    private final BackEdgeDetector backEdgeDetector = new BackEdgeDetector();
    private final TopologicalSorter sorter = new TopologicalSorter();
    private final GatewayPatternDetector patternDetector = new GatewayPatternDetector();
    private final BoundaryIdentifier boundaryIdentifier = new BoundaryIdentifier();
    private final ContainerHierarchyBuilder hierarchyBuilder = new ContainerHierarchyBuilder();
    private final PositionComputer positionComputer = new PositionComputer();
    private final OverlapResolver overlapResolver = new OverlapResolver();
    private final BoundaryPlacer boundaryPlacer = new BoundaryPlacer();
    private final LaneLayoutApplier laneLayoutApplier = new LaneLayoutApplier();
    private final ConnectionRouter router = new ConnectionRouter();
    private final ArtifactPositioner artifactPositioner = new ArtifactPositioner();
    private final LabelPositioner labelPositioner = new LabelPositioner();

    /** State shared by the phases of one run */
    private static class RunContext {
        final DiagramAccessor accessor;
        final LayoutOptions options;
        final ElementMover mover;
        final Set<String> pinnedIds = new HashSet<>();
        final Set<String> backEdgeIds = new HashSet<>();
        final Set<String> exceptionNodeIds = new HashSet<>();
        final Set<String> splitGatewayIds = new HashSet<>();
        final Set<String> joinGatewayIds = new HashSet<>();
        final Map<String, Integer> layers = new LinkedHashMap<>();
        final Map<String, EdgeClass> edgeClasses = new LinkedHashMap<>();
        final List<String> warnings = new ArrayList<>();

        RunContext(DiagramAccessor accessor, LayoutOptions options) {
            this.accessor = accessor;
            this.options = options;
            this.mover = new ElementMover(accessor);
        }

        boolean inScope(String nodeId) {
            return !options.isScoped() || ContainerHierarchyBuilder.isWithin(accessor, nodeId, options.getScopeId());
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Public API
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Lays out the diagram in place.
     *
     * @throws LayoutConfigurationException if the scope id does not name a container
     */
    public LayoutResult layout(DiagramAccessor accessor, LayoutOptions options) {
        validate(accessor, options);
        return run(accessor, options);
    }

    public LayoutResult layout(DiagramAccessor accessor) {
        return layout(accessor, LayoutOptions.defaults());
    }

    /**
     * Runs the layout on a copy of the diagram and reports what would change.
     * The diagram itself is left untouched.
     *
     * @throws LayoutConfigurationException if the scope id does not name a container
     */
    public LayoutPreview preview(DiagramAccessor accessor, LayoutOptions options) {
        validate(accessor, options);
        DiagramSnapshot copy = DiagramSnapshot.copyOf(accessor);
        LayoutResult result = run(copy, options);
        LayoutChangeSet changes = LayoutChangeSet.between(accessor, copy);
        LOG.debug("Preview: {} changes, {}", changes.getChanges().size(), result);
        return new LayoutPreview(result, changes);
    }

    private void validate(DiagramAccessor accessor, LayoutOptions options) {
        if (!options.isScoped())
            return;
        DiagramNode scope = accessor.getNode(options.getScopeId());
        if (scope == null)
            throw new LayoutConfigurationException("Unknown scope container: " + options.getScopeId());
        if (!scope.isContainer())
            throw new LayoutConfigurationException(
                    "Scope " + options.getScopeId() + " is a " + scope.getKind() + ", not an expanded container");
    }

    private LayoutResult run(DiagramAccessor accessor, LayoutOptions options) {
        RunContext ctx = new RunContext(accessor, options);

        Map<String, Bounds> before = new HashMap<>();
        for (DiagramNode node : accessor.getNodes()) {
            before.put(node.getId(), node.getBounds());
        }
        for (String id : options.getPinnedIds()) {
            if (accessor.getNode(id) != null) {
                ctx.pinnedIds.add(id);
            } else {
                LOG.debug("Ignoring unknown pinned node {}", id);
            }
        }

        // Phase 1: CONTAINERS
        List<ContainerNode> worklist = hierarchyBuilder.build(accessor, options.getScopeId());
        for (ContainerNode container : worklist) {
            layoutContainer(ctx, container);
        }

        // Phase 2: STACK
        if (!options.isScoped()) {
            stackPools(ctx);
        }

        // Phase 3: ARTIFACTS
        Predicate<DiagramNode> nodeInScope = node -> ctx.inScope(node.getId());
        List<String> artifactsMoved = artifactPositioner.position(accessor, nodeInScope, ctx.pinnedIds);
        LOG.debug("Repositioned {} artifacts", artifactsMoved.size());

        // Phase 4: ROUTE
        int rerouted = routeEdges(ctx);

        // Phase 5: LABELS
        Predicate<DiagramEdge> edgeInScope = edge -> edgeInScope(ctx, edge);
        int labels = labelPositioner.position(accessor, nodeInScope, edgeInScope);

        int moved = 0;
        for (DiagramNode node : accessor.getNodes()) {
            Bounds old = before.get(node.getId());
            if (old != null && differs(old, node.getBounds())) {
                moved++;
            }
        }

        LayoutResult result = new LayoutResult(moved, rerouted, labels, ctx.edgeClasses, ctx.layers, ctx.warnings);
        LOG.info("Layout finished: {} nodes moved, {} edges rerouted, {} labels moved", moved, rerouted, labels);
        return result;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 1: CONTAINERS
    // ═══════════════════════════════════════════════════════════════════════

    private void layoutContainer(RunContext ctx, ContainerNode container) {
        DiagramAccessor accessor = ctx.accessor;
        LayoutOptions options = ctx.options;
        DiagramNode containerShape = container.isRoot() ? null : accessor.getNode(container.id);
        if (!container.isRoot() && containerShape == null)
            return;

        // Read once, before anything moves
        LaneMembership lanes = LaneMembership.capture(accessor, container.id);

        FlowGraph graph = extractor.extract(accessor, container.id);
        List<BoundaryAttachment> attachments = boundaryIdentifier.identify(accessor, graph);
        Set<String> chainIds = BoundaryIdentifier.chainNodeIds(attachments);
        FlowGraph mainFlow = graph.without(chainIds);

        Map<String, Bounds> targets = new LinkedHashMap<>();
        if (!mainFlow.isEmpty()) {
            computeMainFlow(ctx, mainFlow, targets);
        }

        // ── Boundary events and exception chains ──
        boundaryPlacer.place(attachments, targets, accessor, ctx.pinnedIds, options);
        Map<String, String> hostOf = new HashMap<>();
        for (BoundaryAttachment attachment : attachments) {
            ctx.exceptionNodeIds.add(attachment.boundaryId);
            ctx.exceptionNodeIds.addAll(attachment.chain);
            hostOf.put(attachment.boundaryId, attachment.hostId);
            for (String chainId : attachment.chain) {
                hostOf.put(chainId, attachment.hostId);
            }
        }

        // Boundary events of a pinned host were placed on its final bounds already
        Set<String> anchored = new HashSet<>(ctx.pinnedIds);
        for (BoundaryAttachment attachment : attachments) {
            if (ctx.pinnedIds.contains(attachment.hostId)) {
                anchored.add(attachment.boundaryId);
                anchored.addAll(attachment.chain);
            }
        }

        List<DiagramNode> eventSubProcesses = new ArrayList<>();
        for (DiagramNode child : accessor.getChildren(container.id)) {
            if (FlowGraphExtractor.isEventSubProcess(child)) {
                eventSubProcesses.add(child);
            }
        }

        if (targets.isEmpty() && eventSubProcesses.isEmpty()) {
            LOG.debug("Nothing to lay out in {}", container);
            return;
        }

        // ── Anchor content inside the container ──
        if (containerShape != null) {
            double header = container.isPool() ? LaneLayoutApplier.POOL_HEADER_WIDTH : 0;
            Bounds shape = containerShape.getBounds();
            anchorContent(targets, anchored, shape.x + header + options.getContainerPadding(),
                    shape.y + options.getContainerPadding());
        }

        // ── Lanes ──
        boolean laned = containerShape != null && !lanes.isEmpty();
        if (laned) {
            laneLayoutApplier.apply(accessor, containerShape, lanes, targets, hostOf, anchored, options);
        }

        // ── Event sub-processes below the main flow ──
        placeEventSubProcesses(ctx, eventSubProcesses, targets, containerShape);

        // ── Write back ──
        int written = 0;
        for (Map.Entry<String, Bounds> entry : targets.entrySet()) {
            String id = entry.getKey();
            if (ctx.pinnedIds.contains(id))
                continue;
            DiagramNode node = accessor.getNode(id);
            if (node == null) {
                LOG.debug("Node {} vanished before write-back, skipped", id);
                continue;
            }
            if (differs(node.getBounds(), entry.getValue()) && ctx.mover.moveTo(id, entry.getValue())) {
                written++;
            }
        }
        LOG.debug("Wrote {} positions in {}", written, container);

        // ── Shrink-wrap ──
        if (containerShape != null && !laned && options.isAutoResizeContainers()
                && !ctx.pinnedIds.contains(container.id)) {
            resizeToContent(ctx, container);
        }
    }

    private void computeMainFlow(RunContext ctx, FlowGraph mainFlow, Map<String, Bounds> targets) {
        LayoutOptions options = ctx.options;

        Set<String> backEdges = backEdgeDetector.detect(mainFlow);
        ctx.backEdgeIds.addAll(backEdges);
        LayerAssignment layers = sorter.sort(mainFlow, backEdges);
        ctx.layers.putAll(layers.getLayerMap());
        PatternLookup patterns = patternDetector.detect(mainFlow, backEdges, layers);

        for (DiagramNode node : mainFlow.getNodes()) {
            if (!node.getKind().isGateway())
                continue;
            if (mainFlow.getForwardOutgoing(node.getId(), backEdges).size() >= 2) {
                ctx.splitGatewayIds.add(node.getId());
            }
            if (mainFlow.getForwardIncoming(node.getId(), backEdges).size() >= 2) {
                ctx.joinGatewayIds.add(node.getId());
            }
        }

        Set<String> happyPath = options.getHappyPathPolicy().selectEdges(mainFlow, backEdges);
        Map<String, Point> centers = positionComputer.compute(mainFlow, layers, patterns, backEdges, happyPath,
                ctx.pinnedIds, options.getOrigin(), options);

        if (options.getGridQuantum() > 0) {
            for (Map.Entry<String, Point> entry : centers.entrySet()) {
                if (!ctx.pinnedIds.contains(entry.getKey())) {
                    Point p = entry.getValue();
                    entry.setValue(new Point(options.snap(p.x), options.snap(p.y)));
                }
            }
        }
        int separated = overlapResolver.resolve(centers, layers, ctx.pinnedIds, options);
        if (separated > 0) {
            LOG.debug("Overlap resolver moved {} nodes in {}", separated, mainFlow);
        }

        for (Map.Entry<String, Point> entry : centers.entrySet()) {
            DiagramNode node = mainFlow.getNode(entry.getKey());
            if (ctx.pinnedIds.contains(node.getId())) {
                targets.put(node.getId(), node.getBounds());
            } else {
                Point c = entry.getValue();
                targets.put(node.getId(),
                        Bounds.centeredAt(Math.round(c.x), Math.round(c.y), node.getWidth(), node.getHeight()));
            }
        }
    }

    /** Translates all movable targets so that their bounding box starts at (left, top). */
    private void anchorContent(Map<String, Bounds> targets, Set<String> fixedIds, double left, double top) {
        Bounds box = null;
        for (Map.Entry<String, Bounds> entry : targets.entrySet()) {
            if (!fixedIds.contains(entry.getKey())) {
                box = box == null ? entry.getValue() : box.union(entry.getValue());
            }
        }
        if (box == null)
            return;
        double dx = left - box.x;
        double dy = top - box.y;
        for (Map.Entry<String, Bounds> entry : targets.entrySet()) {
            if (!fixedIds.contains(entry.getKey())) {
                entry.setValue(entry.getValue().translate(dx, dy));
            }
        }
    }

    private void placeEventSubProcesses(RunContext ctx, List<DiagramNode> eventSubProcesses,
            Map<String, Bounds> targets, DiagramNode containerShape) {
        if (eventSubProcesses.isEmpty())
            return;

        Bounds box = null;
        for (Bounds bounds : targets.values()) {
            box = box == null ? bounds : box.union(bounds);
        }
        double gap = ctx.options.getGap();
        double left;
        double top;
        if (box != null) {
            left = box.x;
            top = box.getBottom() + gap;
        } else if (containerShape != null) {
            left = containerShape.getBounds().x + ctx.options.getContainerPadding();
            top = containerShape.getBounds().y + ctx.options.getContainerPadding();
        } else {
            left = ctx.options.getOrigin().x;
            top = ctx.options.getOrigin().y;
        }

        for (DiagramNode sub : eventSubProcesses) {
            if (ctx.pinnedIds.contains(sub.getId())) {
                targets.put(sub.getId(), sub.getBounds());
                continue;
            }
            Bounds bounds = new Bounds(left, top, sub.getWidth(), sub.getHeight());
            targets.put(sub.getId(), bounds);
            left = bounds.getRight() + gap;
        }
    }

    private void resizeToContent(RunContext ctx, ContainerNode container) {
        DiagramAccessor accessor = ctx.accessor;
        Bounds box = null;
        for (DiagramNode child : accessor.getChildren(container.id)) {
            if (child.getKind().isArtifact())
                continue;
            box = box == null ? child.getBounds() : box.union(child.getBounds());
        }
        if (box == null)
            return;

        double padding = ctx.options.getContainerPadding();
        double header = container.isPool() ? LaneLayoutApplier.POOL_HEADER_WIDTH : 0;
        Bounds resized = new Bounds(box.x - padding - header, box.y - padding,
                box.width + 2 * padding + header, box.height + 2 * padding);
        accessor.setNodeBounds(container.id, resized);
        LOG.debug("Resized {} to {}", container, resized);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 2: STACK
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Stacks top-level pools in a single column, top to bottom in their
     * current vertical order, left-aligned with the first pool. Pools go
     * below any flow content sitting directly on the diagram root.
     */
    private void stackPools(RunContext ctx) {
        DiagramAccessor accessor = ctx.accessor;
        List<DiagramNode> pools = new ArrayList<>();
        Bounds rootContent = null;
        for (DiagramNode node : accessor.getChildren(null)) {
            if (node.getKind() == ElementKind.POOL) {
                pools.add(node);
            } else if (!node.getKind().isArtifact()) {
                rootContent = rootContent == null ? node.getBounds() : rootContent.union(node.getBounds());
            }
        }
        if (pools.isEmpty())
            return;
        pools.sort(Comparator.comparingDouble((DiagramNode p) -> p.getBounds().y));

        double gap = ctx.options.getPoolGap();
        double left = pools.get(0).getBounds().x;
        Double cursor = rootContent == null ? null : rootContent.getBottom() + gap;
        for (DiagramNode pool : pools) {
            Bounds bounds = pool.getBounds();
            if (!ctx.pinnedIds.contains(pool.getId())) {
                double top = cursor == null ? bounds.y : cursor;
                ctx.mover.moveBy(pool.getId(), left - bounds.x, top - bounds.y);
                bounds = accessor.getNode(pool.getId()).getBounds();
            }
            cursor = bounds.getBottom() + gap;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 4: ROUTE
    // ═══════════════════════════════════════════════════════════════════════

    private int routeEdges(RunContext ctx) {
        DiagramAccessor accessor = ctx.accessor;
        Map<EdgeClass, List<DiagramEdge>> buckets = new EnumMap<>(EdgeClass.class);
        for (EdgeClass edgeClass : EdgeClass.values()) {
            buckets.put(edgeClass, new ArrayList<>());
        }

        int crossingScope = 0;
        for (DiagramEdge edge : new ArrayList<>(accessor.getEdges())) {
            DiagramNode source = edge.getSourceId() == null ? null : accessor.getNode(edge.getSourceId());
            DiagramNode target = edge.getTargetId() == null ? null : accessor.getNode(edge.getTargetId());
            if (source == null || target == null) {
                LOG.debug("Skipping dangling edge {}", edge);
                continue;
            }
            boolean sourceIn = ctx.inScope(source.getId());
            boolean targetIn = ctx.inScope(target.getId());
            if (sourceIn != targetIn) {
                crossingScope++;
                continue;
            }
            if (!sourceIn)
                continue;
            buckets.get(classify(ctx, edge, source, target)).add(edge);
        }

        if (ctx.options.isScoped()) {
            String warning = "Scoped layout of " + ctx.options.getScopeId() + ": " + crossingScope
                    + " edges crossing the container boundary were not rerouted";
            ctx.warnings.add(warning);
            LOG.warn(warning);
        }

        int rerouted = 0;
        Map<String, Integer> detoursPerContainer = new HashMap<>();
        for (EdgeClass edgeClass : EdgeClass.values()) {
            for (DiagramEdge edge : buckets.get(edgeClass)) {
                Bounds s = accessor.getNode(edge.getSourceId()).getBounds();
                Bounds t = accessor.getNode(edge.getTargetId()).getBounds();
                List<Point> waypoints;
                switch (edgeClass) {
                case FORWARD:
                    waypoints = router.routeForward(s, t, ctx.splitGatewayIds.contains(edge.getSourceId()),
                            ctx.joinGatewayIds.contains(edge.getTargetId()));
                    break;
                case BACK_EDGE:
                    String parentId = accessor.getNode(edge.getSourceId()).getParentId();
                    int index = detoursPerContainer.merge(String.valueOf(parentId), 1, Integer::sum) - 1;
                    double detourY = detourBase(accessor, parentId, s, t) + ConnectionRouter.BACK_EDGE_MARGIN
                            + index * ConnectionRouter.BACK_EDGE_STAGGER;
                    waypoints = router.routeBackEdge(s, t, detourY);
                    break;
                case EXCEPTION_CHAIN:
                    if (accessor.getNode(edge.getSourceId()).isAttached()) {
                        waypoints = router.routeException(s, t);
                    } else {
                        waypoints = router.routeForward(s, t, false, false);
                    }
                    break;
                case ASSOCIATION:
                    waypoints = router.routeAssociation(s, t);
                    break;
                default:
                    waypoints = router.routeCrossContainer(s, t);
                    break;
                }
                boolean changed = differs(edge.getWaypoints(), waypoints);
                if (accessor.setWaypoints(edge.getId(), waypoints)) {
                    ctx.edgeClasses.put(edge.getId(), edgeClass);
                    if (changed) {
                        rerouted++;
                    }
                }
            }
        }
        return rerouted;
    }

    private EdgeClass classify(RunContext ctx, DiagramEdge edge, DiagramNode source, DiagramNode target) {
        if (edge.getKind() == ConnectionKind.ASSOCIATION)
            return EdgeClass.ASSOCIATION;
        if (edge.getKind() == ConnectionKind.MESSAGE_FLOW
                || !Objects.equals(source.getParentId(), target.getParentId()))
            return EdgeClass.CROSS_CONTAINER;
        if (ctx.exceptionNodeIds.contains(source.getId()) || ctx.exceptionNodeIds.contains(target.getId()))
            return EdgeClass.EXCEPTION_CHAIN;
        if (ctx.backEdgeIds.contains(edge.getId()))
            return EdgeClass.BACK_EDGE;
        return EdgeClass.FORWARD;
    }

    /** Lowest bottom edge among the container's shapes spanning the back-edge horizontally. */
    private double detourBase(DiagramAccessor accessor, String parentId, Bounds source, Bounds target) {
        double minX = Math.min(source.getCenterX(), target.getCenterX());
        double maxX = Math.max(source.getCenterX(), target.getCenterX());
        double bottom = Math.max(source.getBottom(), target.getBottom());
        for (DiagramNode node : accessor.getChildren(parentId)) {
            if (node.getKind().isArtifact())
                continue;
            Bounds b = node.getBounds();
            if (b.getRight() >= minX && b.x <= maxX) {
                bottom = Math.max(bottom, b.getBottom());
            }
        }
        return bottom;
    }

    private boolean edgeInScope(RunContext ctx, DiagramEdge edge) {
        return edge.getSourceId() != null && edge.getTargetId() != null && ctx.inScope(edge.getSourceId())
                && ctx.inScope(edge.getTargetId());
    }

    private static boolean differs(List<Point> before, List<Point> after) {
        if (before == null || before.size() != after.size())
            return true;
        for (int i = 0; i < after.size(); i++) {
            Point p = before.get(i);
            Point q = after.get(i);
            if (Math.abs(p.x - q.x) >= MOVE_EPSILON || Math.abs(p.y - q.y) >= MOVE_EPSILON)
                return true;
        }
        return false;
    }

    private static boolean differs(Bounds a, Bounds b) {
        return Math.abs(a.x - b.x) >= MOVE_EPSILON || Math.abs(a.y - b.y) >= MOVE_EPSILON
                || Math.abs(a.width - b.width) >= MOVE_EPSILON || Math.abs(a.height - b.height) >= MOVE_EPSILON;
    }
}
