package com.processlayout.elk;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.elk.alg.layered.options.LayeredMetaDataProvider;
import org.eclipse.elk.core.RecursiveGraphLayoutEngine;
import org.eclipse.elk.core.data.LayoutMetaDataService;
import org.eclipse.elk.core.util.BasicProgressMonitor;
import org.eclipse.elk.graph.ElkBendPoint;
import org.eclipse.elk.graph.ElkEdge;
import org.eclipse.elk.graph.ElkEdgeSection;
import org.eclipse.elk.graph.ElkNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processlayout.reposition.ArtifactPositioner;
import com.processlayout.reposition.ConnectionRouter;
import com.processlayout.reposition.LabelPositioner;
import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.ConnectionKind;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.Point;

/**
 * First layout of a diagram that has no usable geometry yet, for instance
 * right after an import.
 *
 * The diagram is converted into an ELK graph, laid out by ELK's layered
 * algorithm, and the absolute coordinates are written back through the
 * accessor. Boundary events are then spread along their host's bottom
 * edge, artifacts and labels follow their owners, and the edges ELK does
 * not know about are routed directly. Running the repositioning engine
 * afterwards refines the result (lanes, gateway symmetry, exception chains).
 */
public class InitialPlacement {

    private static final Logger LOG = LoggerFactory.getLogger(InitialPlacement.class);

    private static boolean providersRegistered;

    private final ConnectionRouter router = new ConnectionRouter();

    /** ELK resolves algorithms by id through its meta data service. */
    static synchronized void registerLayoutProviders() {
        if (!providersRegistered) {
            LayoutMetaDataService.getInstance().registerLayoutMetaDataProviders(new LayeredMetaDataProvider());
            providersRegistered = true;
        }
    }

    /**
     * @throws InitialPlacementException if ELK fails on the diagram
     */
    public PlacementResult place(DiagramAccessor accessor) {
        registerLayoutProviders();

        // 1. Build ELK Graph
        ElkGraphBuilder builder = new ElkGraphBuilder();
        ElkNode rootNode = builder.buildGraph(accessor);
        LOG.debug("Starting ELK layout with {} nodes, {} root children", builder.getNodeMap().size(),
                rootNode.getChildren().size());

        // 2. Execute Layout
        try {
            new RecursiveGraphLayoutEngine().layout(rootNode, new BasicProgressMonitor());
        } catch (RuntimeException e) {
            LOG.error("ELK layout failed", e);
            throw new InitialPlacementException("ELK layout failed: " + e.getMessage(), e);
        }

        // 3. Apply coordinates
        int moved = 0;
        for (Map.Entry<String, ElkNode> entry : builder.getNodeMap().entrySet()) {
            ElkNode elkNode = entry.getValue();
            Point origin = absolutePosition(elkNode);
            Bounds bounds = new Bounds(Math.round(origin.x), Math.round(origin.y), elkNode.getWidth(),
                    elkNode.getHeight());
            DiagramNode node = accessor.getNode(entry.getKey());
            if (node != null && !node.getBounds().equals(bounds) && accessor.setNodeBounds(node.getId(), bounds)) {
                moved++;
            }
        }
        moved += placeBoundaryEvents(accessor);
        moved += new ArtifactPositioner().position(accessor, node -> true, Set.of()).size();

        // 4. Edges
        int rerouted = 0;
        Map<String, ElkEdge> elkEdges = new LinkedHashMap<>();
        collectEdges(rootNode, elkEdges);
        for (DiagramEdge edge : new ArrayList<>(accessor.getEdges())) {
            List<Point> waypoints = waypointsFor(accessor, edge, elkEdges.get(edge.getId()));
            if (waypoints != null && accessor.setWaypoints(edge.getId(), waypoints)) {
                rerouted++;
            }
        }

        new LabelPositioner().position(accessor, node -> true, edge -> true);

        PlacementResult result = new PlacementResult(moved, rerouted);
        LOG.info("Initial placement complete: root graph {}x{}, {}", rootNode.getWidth(), rootNode.getHeight(),
                result);
        return result;
    }

    /**
     * Spreads the boundary events of each host evenly along its bottom edge.
     */
    private int placeBoundaryEvents(DiagramAccessor accessor) {
        Map<String, List<DiagramNode>> byHost = new LinkedHashMap<>();
        for (DiagramNode node : accessor.getNodes()) {
            if (node.isAttached() && accessor.getNode(node.getHostId()) != null) {
                byHost.computeIfAbsent(node.getHostId(), k -> new ArrayList<>()).add(node);
            }
        }

        int moved = 0;
        for (Map.Entry<String, List<DiagramNode>> entry : byHost.entrySet()) {
            Bounds host = accessor.getNode(entry.getKey()).getBounds();
            List<DiagramNode> events = entry.getValue();
            for (int i = 0; i < events.size(); i++) {
                DiagramNode event = events.get(i);
                double cx = host.x + host.width * (i + 1) / (events.size() + 1);
                Bounds bounds = Bounds.centeredAt(Math.round(cx), host.getBottom(), event.getWidth(),
                        event.getHeight());
                if (!bounds.equals(event.getBounds()) && accessor.setNodeBounds(event.getId(), bounds)) {
                    moved++;
                }
            }
        }
        return moved;
    }

    private List<Point> waypointsFor(DiagramAccessor accessor, DiagramEdge edge, ElkEdge elkEdge) {
        if (elkEdge != null && !elkEdge.getSections().isEmpty()) {
            ElkEdgeSection section = elkEdge.getSections().get(0);
            Point offset = elkEdge.getContainingNode() == null ? new Point(0, 0)
                    : absolutePosition(elkEdge.getContainingNode());
            List<Point> points = new ArrayList<>();
            points.add(new Point(section.getStartX() + offset.x, section.getStartY() + offset.y));
            for (ElkBendPoint bendPoint : section.getBendPoints()) {
                points.add(new Point(bendPoint.getX() + offset.x, bendPoint.getY() + offset.y));
            }
            points.add(new Point(section.getEndX() + offset.x, section.getEndY() + offset.y));
            return points;
        }

        DiagramNode source = edge.getSourceId() == null ? null : accessor.getNode(edge.getSourceId());
        DiagramNode target = edge.getTargetId() == null ? null : accessor.getNode(edge.getTargetId());
        if (source == null || target == null)
            return null;
        if (edge.getKind() == ConnectionKind.ASSOCIATION)
            return router.routeAssociation(source.getBounds(), target.getBounds());
        if (source.isAttached())
            return router.routeException(source.getBounds(), target.getBounds());
        return null;
    }

    private void collectEdges(ElkNode node, Map<String, ElkEdge> edges) {
        for (ElkEdge edge : node.getContainedEdges()) {
            edges.put(edge.getIdentifier(), edge);
        }
        for (ElkNode child : node.getChildren()) {
            collectEdges(child, edges);
        }
    }

    /** Absolute coordinates: ELK positions are relative to the parent node; the root has none. */
    static Point absolutePosition(ElkNode elkNode) {
        double x = 0;
        double y = 0;
        ElkNode current = elkNode;
        while (current != null && current.getParent() != null) {
            x += current.getX();
            y += current.getY();
            current = current.getParent();
        }
        return new Point(x, y);
    }
}
