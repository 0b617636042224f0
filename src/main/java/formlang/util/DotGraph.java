package formlang.util;

import java.util.*;

import guru.nidi.graphviz.attribute.*;
import guru.nidi.graphviz.model.*;

import static guru.nidi.graphviz.attribute.Attributes.attr;
import static guru.nidi.graphviz.model.Factory.*;

/**
 * Small builder around a graphviz-java graph that keys nodes by arbitrary objects
 * and serializes the result into dot format.
 */
public class DotGraph {

	private final MutableGraph graph;
	private final Map<Object, MutableNode> nodes = new LinkedHashMap<>();
	private final String nodePrefix;
	private int clusterCount = 0;

	public DotGraph(String name) {
		this(mutGraph(name).setDirected(true), "n");
	}

	private DotGraph(MutableGraph graph, String nodePrefix) {
		this.graph = graph;
		this.nodePrefix = nodePrefix;
		graph.nodeAttrs().add(Font.name("Helvetica"));
		graph.linkAttrs().add(Font.name("Helvetica"));
	}

	/**
	 * Adds a labelled cluster, its nodes are distinct from the nodes of this graph
	 */
	public DotGraph cluster(String label){
		int index = clusterCount++;
		MutableGraph sub = mutGraph("cluster_" + index).setDirected(true).setCluster(true);
		sub.graphAttrs().add(Label.of(Utils.toPrintableRepresentation(label)));
		graph.add(sub);
		return new DotGraph(sub, nodePrefix + "c" + index + "_");
	}

	/**
	 * Returns the node for the passed key, creating it if needed
	 */
	public MutableNode node(Object key){
		return nodes.computeIfAbsent(key, k -> {
			MutableNode node = mutNode(nodePrefix + nodes.size()).add(Label.of(Utils.toPrintableRepresentation(String.valueOf(k))));
			graph.add(node);
			return node;
		});
	}

	public MutableNode node(Object key, String label){
		return node(key).add(Label.of(Utils.toPrintableRepresentation(label)));
	}

	public DotGraph startNode(Object key){
		node(key).add(Style.FILLED, Color.GREEN.fill());
		return this;
	}

	public DotGraph finalNode(Object key){
		node(key).add(attr("peripheries", 2));
		return this;
	}

	public DotGraph edge(Object from, Object to, String label){
		MutableNode target = node(to);
		node(from).addLink(to(target).with(Label.of(Utils.toPrintableRepresentation(label))));
		return this;
	}

	public DotGraph edge(Object from, Object to){
		MutableNode target = node(to);
		node(from).addLink(target);
		return this;
	}

	/**
	 * Serializes the graph in dot format
	 */
	@Override
	public String toString() {
		return graph.toString();
	}
}
