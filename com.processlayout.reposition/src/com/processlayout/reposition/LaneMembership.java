package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.Lane;

/**
 * Lane membership of one container, captured once at the start of its
 * layout pass. A lane's declared member set wins over a node's own lane id.
 */
public class LaneMembership {

    private final List<Lane> lanes;
    private final Map<String, String> laneOfNode;

    private LaneMembership(List<Lane> lanes, Map<String, String> laneOfNode) {
        this.lanes = Collections.unmodifiableList(lanes);
        this.laneOfNode = Collections.unmodifiableMap(laneOfNode);
    }

    public static LaneMembership capture(DiagramAccessor accessor, String containerId) {
        List<Lane> lanes = new ArrayList<>(accessor.getLanes(containerId));
        lanes.sort(Comparator.comparingInt(Lane::getBandIndex));

        Map<String, String> laneOfNode = new HashMap<>();
        for (Lane lane : lanes) {
            for (String member : lane.getMemberIds()) {
                laneOfNode.putIfAbsent(member, lane.getId());
            }
        }
        for (DiagramNode node : accessor.getChildren(containerId)) {
            if (node.getLaneId() != null && accessor.getLane(node.getLaneId()) != null) {
                laneOfNode.putIfAbsent(node.getId(), node.getLaneId());
            }
        }
        return new LaneMembership(lanes, laneOfNode);
    }

    public boolean isEmpty() {
        return lanes.isEmpty();
    }

    /** Lanes sorted by band index. */
    public List<Lane> getLanes() {
        return lanes;
    }

    public String getLaneOf(String nodeId) {
        return laneOfNode.get(nodeId);
    }
}
