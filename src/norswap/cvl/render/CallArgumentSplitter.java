package norswap.cvl.render;

import norswap.cvl.ast.CvlNode;
import norswap.cvl.ast.TokenNode;
import norswap.cvl.ast.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the {@code exprs} node of a call into argument texts.
 *
 * <p>The grammar does not keep one subtree per argument, so the split is a best-effort guess, in
 * this order:
 * <ol>
 *     <li>If any child is a tree node, the whole list is one argument: the commas left at the top
 *     level can't be told apart from commas belonging to a nested call.</li>
 *     <li>Otherwise, if a comma token is present, the tokens are split on commas.</li>
 *     <li>Otherwise, if every token is atomic (identifier or literal), each is an argument.</li>
 *     <li>Otherwise, the tokens form a single argument.</li>
 * </ol>
 *
 * <p>Every token but the separating commas ends up in exactly one argument.
 */
public final class CallArgumentSplitter
{
    private static final Logger log = LoggerFactory.getLogger(CallArgumentSplitter.class);

    private CallArgumentSplitter () {}

    // ---------------------------------------------------------------------------------------------

    /**
     * Splits {@code exprs} (possibly null, yielding no arguments), rendering arguments with
     * {@code renderer}.
     */
    public static List<String> split (TreeNode exprs, SymbolAwareRenderer renderer)
    {
        List<String> args = new ArrayList<>();
        if (exprs == null || exprs.children.isEmpty())
            return args;

        List<CvlNode> children = exprs.children;

        for (CvlNode child: children) {
            if (child instanceof TreeNode) {
                log.trace("compound child in {}, single argument", exprs);
                args.add(renderer.renderAll(children));
                return args;
            }
        }

        boolean comma = false;
        boolean atomic = true;
        for (CvlNode child: children) {
            TokenNode token = (TokenNode) child;
            comma  |= token.isComma();
            atomic &= token.kind.atomic;
        }

        if (comma) {
            log.trace("splitting {} on commas", exprs);
            List<CvlNode> run = new ArrayList<>();
            for (CvlNode child: children) {
                if (!((TokenNode) child).isComma()) {
                    run.add(child);
                } else if (!run.isEmpty()) {
                    args.add(renderer.renderAll(run));
                    run = new ArrayList<>();
                }
            }
            if (!run.isEmpty())
                args.add(renderer.renderAll(run));
        }
        else if (atomic) {
            log.trace("atomic tokens in {}, one argument each", exprs);
            for (CvlNode child: children)
                args.add(((TokenNode) child).text);
        }
        else {
            log.trace("operator tokens in {}, single argument", exprs);
            args.add(renderer.renderAll(children));
        }

        return args;
    }
}
