package norswap.cvl.ast;

import norswap.autumn.positions.Span;
import norswap.utils.Util;

public final class TokenNode extends CvlNode
{
    public final TokenKind kind;
    public final String text;

    public TokenNode (Span span, Object kind, Object text) {
        super(span);
        this.kind = Util.cast(kind, TokenKind.class);
        this.text = Util.cast(text, String.class);
    }

    public TokenNode (TokenKind kind, String text) {
        this(null, kind, text);
    }

    public boolean is (TokenKind kind) {
        return this.kind == kind;
    }

    public boolean isComma () {
        return ",".equals(text);
    }

    @Override public String contents () {
        return kind.name() + ":" + quote(text);
    }

    private static String quote (String text)
    {
        boolean bare = !text.isEmpty();
        for (int i = 0; bare && i < text.length(); ++i) {
            char c = text.charAt(i);
            bare = !Character.isWhitespace(c) && c != '(' && c != ')' && c != '"';
        }
        if (bare) return text;

        StringBuilder b = new StringBuilder("\"");
        for (char c: text.toCharArray()) {
            switch (c) {
                case '"':  b.append("\\\""); break;
                case '\\': b.append("\\\\"); break;
                case '\n': b.append("\\n");  break;
                case '\r': b.append("\\r");  break;
                case '\t': b.append("\\t");  break;
                default:   b.append(c);
            }
        }
        return b.append('"').toString();
    }
}
