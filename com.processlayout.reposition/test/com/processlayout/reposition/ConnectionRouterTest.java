package com.processlayout.reposition;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.Point;

class ConnectionRouterTest {

    private final ConnectionRouter router = new ConnectionRouter();

    @Test
    void alignedShapesGetAStraightLine() {
        List<Point> route = router.routeForward(new Bounds(0, 0, 100, 80), new Bounds(150, 0, 100, 80), false, false);

        assertThat(route).containsExactly(new Point(100, 40), new Point(150, 40));
    }

    @Test
    void splitLeavesFromItsBottomVertex() {
        Bounds split = new Bounds(0, 75, 50, 50);
        Bounds lower = new Bounds(100, 160, 100, 80);

        List<Point> route = router.routeForward(split, lower, true, false);

        assertThat(route).containsExactly(new Point(25, 125), new Point(25, 200), new Point(100, 200));
    }

    @Test
    void joinIsEnteredFromAbove() {
        Bounds upper = new Bounds(0, 0, 100, 80);
        Bounds join = new Bounds(200, 75, 50, 50);

        List<Point> route = router.routeForward(upper, join, false, true);

        assertThat(route).containsExactly(new Point(100, 40), new Point(225, 40), new Point(225, 75));
    }

    @Test
    void plainOffsetEdgeBendsHalfway() {
        List<Point> route = router.routeForward(new Bounds(0, 0, 100, 80), new Bounds(200, 100, 100, 80), false,
                false);

        assertThat(route).containsExactly(new Point(100, 40), new Point(150, 40), new Point(150, 140),
                new Point(200, 140));
    }

    @Test
    void backEdgeDetoursBelow() {
        Bounds source = new Bounds(400, 0, 100, 80);
        Bounds target = new Bounds(100, 0, 100, 80);

        List<Point> route = router.routeBackEdge(source, target, 110);

        assertThat(route).containsExactly(new Point(450, 80), new Point(450, 110), new Point(150, 110),
                new Point(150, 80));
        assertThat(route).allSatisfy(p -> assertThat(p.y).isGreaterThanOrEqualTo(80));
    }

    @Test
    void exceptionEdgeGoesDownThenRight() {
        Bounds boundary = new Bounds(82, 62, 36, 36);
        Bounds target = new Bounds(168, 138, 100, 80);

        List<Point> route = router.routeException(boundary, target);

        assertThat(route).containsExactly(new Point(100, 98), new Point(100, 178), new Point(168, 178));
    }

    @Test
    void crossContainerEdgeRunsVerticalFirst() {
        Bounds upper = new Bounds(0, 0, 100, 80);
        Bounds lower = new Bounds(300, 300, 100, 80);

        List<Point> route = router.routeCrossContainer(upper, lower);

        assertThat(route.get(0)).isEqualTo(new Point(50, 80));
        assertThat(route.get(1).x).isEqualTo(50);
        assertThat(route.get(route.size() - 1)).isEqualTo(new Point(350, 300));
    }

    @Test
    void associationIsClippedToBothBorders() {
        List<Point> route = router.routeAssociation(new Bounds(0, 0, 100, 100), new Bounds(200, 0, 100, 100));

        assertThat(route).containsExactly(new Point(100, 50), new Point(200, 50));
    }

    @Test
    void routingIsDeterministic() {
        Bounds a = new Bounds(10, 20, 100, 80);
        Bounds b = new Bounds(300, 250, 36, 36);

        assertThat(router.routeForward(a, b, false, false)).isEqualTo(router.routeForward(a, b, false, false));
    }

    @Test
    void simplifyDropsDuplicatesAndCollinearPoints() {
        List<Point> simplified = ConnectionRouter.simplify(List.of(new Point(0, 0), new Point(0, 0),
                new Point(50, 0), new Point(100, 0), new Point(100, 40)));

        assertThat(simplified).containsExactly(new Point(0, 0), new Point(100, 0), new Point(100, 40));
    }
}
