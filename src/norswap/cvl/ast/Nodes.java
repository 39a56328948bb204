package norswap.cvl.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Predicates and accessors over {@link CvlNode} trees. Scans are iterative, so their depth is not
 * limited by the call stack.
 */
public final class Nodes
{
    private Nodes () {}

    // ---------------------------------------------------------------------------------------------

    public static boolean isToken (Object node, TokenKind kind) {
        return node instanceof TokenNode && ((TokenNode) node).is(kind);
    }

    public static boolean isTree (Object node, Rule rule) {
        return node instanceof TreeNode && ((TreeNode) node).rule == rule;
    }

    public static boolean isComma (Object node) {
        return node instanceof TokenNode && ((TokenNode) node).isComma();
    }

    public static List<CvlNode> children (CvlNode node) {
        return node instanceof TreeNode
            ? ((TreeNode) node).children
            : Collections.emptyList();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the first direct child of {@code node} that applies {@code rule}, or null.
     */
    public static TreeNode firstChild (CvlNode node, Rule rule)
    {
        for (CvlNode child: children(node))
            if (isTree(child, rule))
                return (TreeNode) child;
        return null;
    }

    /**
     * Returns the first direct child of {@code node} that is a token of the given kind, or null.
     */
    public static TokenNode firstChild (CvlNode node, TokenKind kind)
    {
        for (CvlNode child: children(node))
            if (isToken(child, kind))
                return (TokenNode) child;
        return null;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns every token under {@code node} (or {@code node} itself if it is a token), in source
     * order.
     */
    public static List<TokenNode> tokens (CvlNode node)
    {
        List<TokenNode> out = new ArrayList<>();
        Deque<CvlNode> stack = new ArrayDeque<>();
        stack.push(node);

        while (!stack.isEmpty()) {
            CvlNode next = stack.pop();
            if (next instanceof TokenNode) {
                out.add((TokenNode) next);
                continue;
            }
            List<CvlNode> children = children(next);
            for (int i = children.size() - 1; i >= 0; --i)
                stack.push(children.get(i));
        }
        return out;
    }

    /**
     * Returns the first token of the given kind under {@code node}, in source order, or null.
     */
    public static TokenNode firstToken (CvlNode node, TokenKind kind)
    {
        for (TokenNode token: tokens(node))
            if (token.is(kind))
                return token;
        return null;
    }

    /**
     * Returns every tree node under {@code node}, {@code node} included, parents before their
     * children and siblings left to right.
     */
    public static List<TreeNode> subtreesTopDown (CvlNode node)
    {
        List<TreeNode> out = new ArrayList<>();
        Deque<CvlNode> stack = new ArrayDeque<>();
        stack.push(node);

        while (!stack.isEmpty()) {
            CvlNode next = stack.pop();
            if (!(next instanceof TreeNode)) continue;
            out.add((TreeNode) next);
            List<CvlNode> children = ((TreeNode) next).children;
            for (int i = children.size() - 1; i >= 0; --i)
                stack.push(children.get(i));
        }
        return out;
    }
}
