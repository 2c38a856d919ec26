package com.dcruver.litreview.graph;

import com.dcruver.litreview.domain.Hierarchy;
import com.dcruver.litreview.domain.LibraryState;
import com.dcruver.litreview.domain.Paper;
import com.dcruver.litreview.domain.PaperId;
import com.dcruver.litreview.domain.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a classified library into a positioned node/edge graph.
 *
 * <p>Per source collection: a collection node, its query nodes, one tag node per canonical tag
 * (sorted case-insensitively), a curated-highlight node under each tag that has highlight overlay
 * papers, one uncategorized node, and the highlight/relevance aggregate nodes.
 *
 * <p>The uncategorized and aggregate nodes form a side column left of the leftmost query, so
 * they stay clear of every tag stack however many queries a collection has. Collections are at
 * least {@link #COLLECTION_PITCH} apart and are pushed further right when the previous one is wider.
 *
 * <p>Positions depend only on the hierarchy's shape and label lengths. Node id counters
 * start over on every call.
 */
@Component
@Slf4j
public class GraphLayoutEngine {

    static final double COLLECTION_START_X = 100;
    static final double COLLECTION_Y = 50;
    static final double COLLECTION_PITCH = 1400;
    static final double COLLECTION_GAP = 100;

    static final double QUERY_Y_OFFSET = 150;
    static final double QUERY_PITCH = 400;

    static final double TAG_Y_OFFSET = 150;
    static final int CHARS_PER_LINE = 24;
    static final double LINE_HEIGHT = 18;
    static final double NODE_PADDING = 24;
    static final double MIN_GAP = 20;
    static final double NODE_WIDTH = 200;

    static final double HIGHLIGHT_X_OFFSET = 275;

    // Relative to the leftmost query of the collection
    static final double SIDE_COLUMN_X_OFFSET = -500;
    static final double AGGREGATE_HIGHLIGHT_Y_OFFSET = 300;
    static final double AGGREGATE_RELEVANT_Y_OFFSET = 450;

    static final String HIGHLIGHT_LABEL = "Most cited (or of interest)";
    static final String RELEVANT_LABEL = "Most relevant";
    static final String UNCATEGORIZED_LABEL = "Found outside search";

    private static final Comparator<String> TAG_ORDER = Comparator.comparing(t -> t.toLowerCase(Locale.ROOT));

    public VisualizationGraph layout(LibraryState state) {
        Hierarchy hierarchy = state.getHierarchy();
        if (hierarchy.isEmpty()) {
            return VisualizationGraph.empty();
        }

        LayoutRun run = new LayoutRun(state);
        double collectionX = COLLECTION_START_X - COLLECTION_PITCH;
        double previousRight = Double.NEGATIVE_INFINITY;
        for (String collection : hierarchy.collections()) {
            double spread = querySpread(hierarchy.queries(collection).size());
            collectionX = Math.max(collectionX + COLLECTION_PITCH,
                previousRight + COLLECTION_GAP + spread - SIDE_COLUMN_X_OFFSET);
            run.layoutCollection(collection, new Position(collectionX, COLLECTION_Y));
            previousRight = collectionX + spread + HIGHLIGHT_X_OFFSET + NODE_WIDTH;
        }

        log.debug("Laid out {} nodes and {} edges", run.nodes.size(), run.edges.size());
        return new VisualizationGraph(List.copyOf(run.nodes), List.copyOf(run.edges));
    }

    /**
     * Distance from the collection to its outermost query on either side
     */
    static double querySpread(int queryCount) {
        return Math.max(0, queryCount - 1) * QUERY_PITCH / 2;
    }

    /**
     * Estimated rendered height of a node with this label, wrapping at {@link #CHARS_PER_LINE}
     */
    static double labelHeight(String label) {
        int lines = Math.max(1, (label.length() + CHARS_PER_LINE - 1) / CHARS_PER_LINE);
        return lines * LINE_HEIGHT + NODE_PADDING;
    }

    /**
     * Stack nodes top to bottom under {@code query}, each separated by {@link #MIN_GAP}
     */
    static List<Position> stack(Position query, List<String> labels) {
        List<Position> positions = new ArrayList<>(labels.size());
        double y = query.getY() + TAG_Y_OFFSET;
        for (String label : labels) {
            positions.add(new Position(query.getX(), y));
            y += labelHeight(label) + MIN_GAP;
        }
        return positions;
    }

    static String tagLabel(String tag) {
        String clean = tag.strip();
        if (clean.toUpperCase(Locale.ROOT).startsWith("AND ")) {
            clean = clean.substring(4).strip();
        }
        return "AND " + clean;
    }

    /**
     * Keep the first paper per identifier; papers without one are always kept
     */
    static List<Paper> distinctById(List<Paper> papers) {
        Set<PaperId> seen = new HashSet<>();
        List<Paper> result = new ArrayList<>();
        for (Paper paper : papers) {
            if (paper.getId() == null || seen.add(paper.getId())) {
                result.add(paper);
            }
        }
        return result;
    }

    /**
     * Mutable node/edge accumulation for a single layout call
     */
    private static final class LayoutRun {
        private final LibraryState state;
        private final NodeIdSequence ids = new NodeIdSequence();
        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<GraphEdge> edges = new ArrayList<>();

        LayoutRun(LibraryState state) {
            this.state = state;
        }

        void layoutCollection(String collection, Position anchor) {
            Hierarchy hierarchy = state.getHierarchy();
            GraphNode collectionNode = addNode(NodeType.COLLECTION, anchor, NodePayload.builder()
                .label(collection.toUpperCase(Locale.ROOT))
                .collection(collection)
                .build());

            List<String> queries = hierarchy.queries(collection);
            double queryY = anchor.getY() + QUERY_Y_OFFSET;
            double queryStartX = anchor.getX() - querySpread(queries.size());
            Position sideColumn = new Position(queryStartX + SIDE_COLUMN_X_OFFSET, anchor.getY());

            List<GraphNode> highlightNodes = new ArrayList<>();
            List<Paper> highlightPapers = new ArrayList<>();
            List<Paper> uncategorized = new ArrayList<>();
            List<Paper> relevant = new ArrayList<>();

            for (int i = 0; i < queries.size(); i++) {
                String queryName = queries.get(i);
                Position queryPosition = new Position(queryStartX + i * QUERY_PITCH, queryY);
                layoutQuery(collection, queryName, queryPosition, collectionNode, highlightNodes, highlightPapers);

                uncategorized.addAll(hierarchy.bucket(collection, queryName, Hierarchy.UNCATEGORIZED));
                state.getRelevance().buckets(collection, queryName).values().forEach(relevant::addAll);
            }

            GraphNode uncategorizedNode = null;
            if (!uncategorized.isEmpty()) {
                uncategorizedNode = addNode(NodeType.UNCATEGORIZED, sideColumn,
                    NodePayload.withPapers(UNCATEGORIZED_LABEL, uncategorized));
            }

            GraphNode highlightAggregate = null;
            if (!highlightNodes.isEmpty()) {
                List<Paper> combined = new ArrayList<>(highlightPapers);
                combined.addAll(uncategorized);
                highlightAggregate = addNode(NodeType.AGGREGATE_HIGHLIGHT,
                    sideColumn.offset(0, AGGREGATE_HIGHLIGHT_Y_OFFSET),
                    NodePayload.withPapers(HIGHLIGHT_LABEL, distinctById(combined)));

                for (GraphNode highlight : highlightNodes) {
                    addEdge(highlight, highlightAggregate);
                }
                if (uncategorizedNode != null) {
                    addEdge(uncategorizedNode, highlightAggregate);
                }
            }

            if (!relevant.isEmpty()) {
                GraphNode relevantAggregate = addNode(NodeType.AGGREGATE_RELEVANT,
                    sideColumn.offset(0, AGGREGATE_RELEVANT_Y_OFFSET),
                    NodePayload.withPapers(RELEVANT_LABEL, distinctById(relevant)));
                if (highlightAggregate != null) {
                    addEdge(highlightAggregate, relevantAggregate);
                }
            }
        }

        private void layoutQuery(String collection, String queryName, Position position, GraphNode parent,
                                 List<GraphNode> highlightNodes, List<Paper> highlightPapers) {
            String queryText = state.findQuery(queryName).map(Query::displayQuery).orElse(queryName);
            GraphNode queryNode = addNode(NodeType.QUERY, position, NodePayload.builder()
                .label(queryName)
                .query(queryText)
                .queryName(queryName)
                .build());
            addEdge(parent, queryNode);

            Map<String, List<Paper>> buckets = state.getHierarchy().buckets(collection, queryName);
            List<String> tags = buckets.keySet().stream()
                .filter(tag -> !Hierarchy.UNCATEGORIZED.equals(tag))
                .sorted(TAG_ORDER)
                .toList();
            List<String> labels = tags.stream().map(GraphLayoutEngine::tagLabel).toList();
            List<Position> positions = stack(position, labels);

            for (int i = 0; i < tags.size(); i++) {
                String tag = tags.get(i);
                List<Paper> papers = buckets.get(tag);
                GraphNode tagNode = addNode(NodeType.TAG, positions.get(i), NodePayload.builder()
                    .label(labels.get(i))
                    .tag(tag)
                    .queryName(queryName)
                    .papers(List.copyOf(papers))
                    .paperCount(papers.size())
                    .build());
                addEdge(queryNode, tagNode);

                List<Paper> highlighted = state.getHighlights().bucket(collection, queryName, tag);
                if (highlighted.isEmpty()) {
                    continue;
                }
                GraphNode highlightNode = addNode(NodeType.CURATED_HIGHLIGHT,
                    positions.get(i).offset(HIGHLIGHT_X_OFFSET, 0),
                    NodePayload.withPapers(HIGHLIGHT_LABEL, highlighted));
                addEdge(tagNode, highlightNode);
                highlightNodes.add(highlightNode);
                highlightPapers.addAll(highlighted);
            }
        }

        private GraphNode addNode(NodeType type, Position position, NodePayload payload) {
            GraphNode node = new GraphNode(ids.next(type), type, position, payload);
            nodes.add(node);
            return node;
        }

        private void addEdge(GraphNode source, GraphNode target) {
            edges.add(GraphEdge.between(source, target));
        }
    }
}
