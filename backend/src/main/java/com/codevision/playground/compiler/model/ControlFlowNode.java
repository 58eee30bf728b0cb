package com.codevision.playground.compiler.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the control-flow graph. Successors are only added while the graph is built; every
 * node has a single predecessor, so the graph serializes as a tree.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ControlFlowNode {

    private final String id;
    private final ControlFlowKind kind;
    private final String condition;
    private final String label;
    private final List<ControlFlowNode> children = new ArrayList<>();

    public ControlFlowNode(String id, ControlFlowKind kind, String condition, String label) {
        this.id = id;
        this.kind = kind;
        this.condition = condition;
        this.label = label;
    }

    public static ControlFlowNode of(String id, ControlFlowKind kind) {
        return new ControlFlowNode(id, kind, null, null);
    }

    public String getId() {
        return id;
    }

    public ControlFlowKind getKind() {
        return kind;
    }

    public String getCondition() {
        return condition;
    }

    public String getLabel() {
        return label;
    }

    public List<ControlFlowNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(ControlFlowNode child) {
        children.add(child);
    }

    /** Follows the last successor until a node without successors is reached. */
    public ControlFlowNode lastReachable() {
        ControlFlowNode node = this;
        while (!node.children.isEmpty()) {
            node = node.children.get(node.children.size() - 1);
        }
        return node;
    }

    public int count(ControlFlowKind kind) {
        int count = this.kind == kind ? 1 : 0;
        for (ControlFlowNode child : children) {
            count += child.count(kind);
        }
        return count;
    }

    @Override
    public String toString() {
        return kind + "(" + id + ")" + (children.isEmpty() ? "" : " -> " + children);
    }
}
