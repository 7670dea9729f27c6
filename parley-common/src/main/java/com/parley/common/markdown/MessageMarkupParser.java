package com.parley.common.markdown;

import com.parley.common.markdown.MessageMarkup.Style;
import com.parley.common.markdown.MessageMarkup.StyleSpan;
import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.BulletListItem;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.OrderedListItem;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.Strikethrough;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.misc.Extension;
import com.vladsch.flexmark.util.sequence.BasedSequence;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chat message markup parser backed by
 * <a href="https://github.com/vsch/flexmark-java">flexmark-java</a>.
 * Produces {@link MessageMarkup} by walking the AST.
 *
 * <p>
 * Block and emphasis rules come from flexmark (bold, italic, strikethrough,
 * code, code blocks, links, autolinks, lists, headings, blockquotes). Text
 * nodes are then scanned for the chat-specific inline rules enabled in
 * {@link MarkupOptions}: math, color previews, emoji shortcodes, bare
 * custom-domain links, and user mentions.
 *
 * <p>
 * Instances are immutable and thread-safe. Parsing never throws: input that
 * cannot be handled degrades to literal text.
 */
@Slf4j
public final class MessageMarkupParser {

    private static final String TRAILING_PUNCTUATION = ".,;:!?)'\"-";

    private final Parser parser;
    private final Pattern inlinePattern;
    private final Set<String> inlineGroups = new HashSet<>();

    public MessageMarkupParser(MarkupOptions options) {
        MutableDataSet flexOpts = new MutableDataSet();
        List<Extension> extensions = new ArrayList<>();
        extensions.add(StrikethroughExtension.create());
        extensions.add(AutolinkExtension.create());
        flexOpts.set(Parser.EXTENSIONS, extensions);
        this.parser = Parser.builder(flexOpts).build();
        this.inlinePattern = compileInlinePattern(options != null ? options : MarkupOptions.defaults(), inlineGroups);
    }

    /**
     * Parse with {@link MarkupOptions#defaults()}.
     */
    public static MessageMarkup parseDefault(String markdown) {
        return new MessageMarkupParser(MarkupOptions.defaults()).parse(markdown);
    }

    public MessageMarkup parse(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return MessageMarkup.plainText("");
        }
        try {
            Node document = parser.parse(markdown);
            RenderState state = new RenderState();
            renderNode(document, state);
            return state.build();
        } catch (RuntimeException e) {
            log.warn("Markup parsing failed, keeping literal text: {}", e.getMessage());
            return MessageMarkup.plainText(markdown);
        }
    }

    // -----------------------------------------------------------------------
    // AST walker
    // -----------------------------------------------------------------------

    private void renderNode(Node node, RenderState state) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            renderSingle(child, state);
        }
    }

    private void renderSingle(Node node, RenderState state) {
        // ---- Block-level ----
        if (node instanceof Heading heading) {
            state.openStyle(Style.BOLD);
            renderNode(heading, state);
            state.closeStyle(Style.BOLD);
            state.appendParagraphSeparator();

        } else if (node instanceof Paragraph) {
            renderNode(node, state);
            state.appendParagraphSeparator();

        } else if (node instanceof BlockQuote) {
            state.append("> ");
            renderNode(node, state);
            state.append("\n");

        } else if (node instanceof BulletList) {
            state.pushList(false);
            renderNode(node, state);
            state.popList();

        } else if (node instanceof OrderedList) {
            state.pushList(true);
            renderNode(node, state);
            state.popList();

        } else if (node instanceof BulletListItem || node instanceof OrderedListItem) {
            state.appendListPrefix();
            renderNode(node, state);

        } else if (node instanceof FencedCodeBlock fcb) {
            appendCodeBlock(fcb.getContentChars().toString(), state);

        } else if (node instanceof IndentedCodeBlock icb) {
            appendCodeBlock(icb.getContentChars().toString(), state);

        } else if (node instanceof ThematicBreak) {
            state.append("\n");

        } else if (node instanceof HtmlBlock hb) {
            // Kept literal, but still scanned for mentions and inline rules
            appendInline(hb.getChars(), state, false);

            // ---- Inline ----
        } else if (node instanceof Text text) {
            appendInline(text.getChars(), state, true);

        } else if (node instanceof Code code) {
            int start = state.position();
            state.append(code.getText().toString());
            state.addStyle(start, state.position(), Style.CODE, null);

        } else if (node instanceof Emphasis) {
            state.openStyle(Style.ITALIC);
            renderNode(node, state);
            state.closeStyle(Style.ITALIC);

        } else if (node instanceof StrongEmphasis) {
            state.openStyle(Style.BOLD);
            renderNode(node, state);
            state.closeStyle(Style.BOLD);

        } else if (node instanceof Strikethrough) {
            state.openStyle(Style.STRIKETHROUGH);
            renderNode(node, state);
            state.closeStyle(Style.STRIKETHROUGH);

        } else if (node instanceof Link link) {
            String href = link.getUrl().toString();
            int start = state.position();
            renderNode(link, state);
            state.addLink(start, state.position(), href);

        } else if (node instanceof AutoLink al) {
            String url = al.getUrl().toString();
            int start = state.position();
            state.append(url);
            state.addLink(start, state.position(), withScheme(url));

        } else if (node instanceof MailLink ml) {
            String address = ml.getText().toString();
            int start = state.position();
            state.append(address);
            state.addLink(start, state.position(), "mailto:" + address);

        } else if (node instanceof Image img) {
            appendInline(img.getText(), state, true);

        } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
            state.append("\n");

        } else if (node instanceof HtmlInline hi) {
            appendInline(hi.getChars(), state, false);

        } else {
            // Unknown node, descend into children
            renderNode(node, state);
        }
    }

    private static void appendCodeBlock(String code, RenderState state) {
        if (!code.endsWith("\n"))
            code += "\n";
        int start = state.position();
        state.append(code);
        state.addStyle(start, state.position(), Style.CODE_BLOCK, null);
        if (state.listDepth() == 0)
            state.append("\n");
    }

    private static String withScheme(String url) {
        return url.contains("://") ? url : "https://" + url;
    }

    // -----------------------------------------------------------------------
    // Inline chat rules
    // -----------------------------------------------------------------------

    private static Pattern compileInlinePattern(MarkupOptions options, Set<String> groups) {
        List<String> alternatives = new ArrayList<>();
        if (options.katex() != null && options.katex().dollarSyntax()) {
            alternatives.add("\\$(?<dmath>[^$\\s](?:[^$\\n]*?[^$\\s])?)\\$");
            groups.add("dmath");
        }
        if (options.katex() != null && options.katex().parenthesisSyntax()) {
            alternatives.add("\\\\\\((?<pmath>.+?)\\\\\\)");
            groups.add("pmath");
        }
        if (options.colors()) {
            alternatives.add("color:(?<color>#(?:[0-9a-fA-F]{8}|[0-9a-fA-F]{6}|[0-9a-fA-F]{3,4}))(?![0-9a-fA-F])");
            groups.add("color");
        }
        if (options.emoticons()) {
            alternatives.add("(?<!\\w):(?<emoji>[a-z0-9_+\\-]+):");
            groups.add("emoji");
        }
        alternatives.add("(?<![\\w@])@(?<mention>\\w[\\w.\\-]*)");
        groups.add("mention");
        if (!options.customDomains().isEmpty()) {
            List<String> quoted = options.customDomains().stream().map(Pattern::quote).toList();
            alternatives.add("(?<![\\w.@/:\\-])(?<domain>(?i:(?:[a-z0-9\\-]+\\.)*(?:"
                    + String.join("|", quoted) + "))(?::\\d+)?(?:/[^\\s<>]*)?)(?![\\w\\-]|\\.\\w)");
            groups.add("domain");
        }
        return Pattern.compile(String.join("|", alternatives));
    }

    private String group(Matcher m, String name) {
        return inlineGroups.contains(name) ? m.group(name) : null;
    }

    /**
     * Append text, applying the inline chat rules. With {@code unescape} off the
     * text between matches is copied verbatim (raw HTML).
     */
    private void appendInline(BasedSequence chars, RenderState state, boolean unescape) {
        String raw = chars.toString();
        Matcher m = inlinePattern.matcher(raw);
        int index = 0;
        while (m.find()) {
            if (m.start() > index) {
                state.append(literal(chars.subSequence(index, m.start()), unescape));
            }
            int end = m.end();
            String value;
            if ((value = group(m, "dmath")) != null || (value = group(m, "pmath")) != null) {
                int start = state.position();
                state.append(value);
                state.addStyle(start, state.position(), Style.MATH, value);

            } else if ((value = group(m, "color")) != null) {
                int start = state.position();
                state.append(m.group());
                state.addStyle(start, state.position(), Style.COLOR, value.toLowerCase());

            } else if ((value = group(m, "emoji")) != null) {
                int start = state.position();
                state.append(m.group());
                state.addStyle(start, state.position(), Style.EMOJI, value);

            } else if ((value = group(m, "mention")) != null) {
                String name = stripTrailingPunctuation(value);
                end = m.start("mention") + name.length();
                state.append("@" + name);
                state.addMention(name);

            } else if ((value = group(m, "domain")) != null) {
                String host = stripTrailingPunctuation(value);
                end = m.start("domain") + host.length();
                int start = state.position();
                state.append(host);
                state.addLink(start, state.position(), "https://" + host);
            }
            index = end;
        }
        if (index < raw.length()) {
            state.append(literal(chars.subSequence(index, raw.length()), unescape));
        }
    }

    private static String literal(BasedSequence chars, boolean unescape) {
        return unescape ? chars.unescape() : chars.toString();
    }

    private static String stripTrailingPunctuation(String value) {
        int end = value.length();
        while (end > 1 && TRAILING_PUNCTUATION.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(0, end);
    }

    // -----------------------------------------------------------------------
    // Render state
    // -----------------------------------------------------------------------

    private static class RenderState {
        private final MessageMarkup.Builder builder = MessageMarkup.builder();
        private final Deque<OpenStyle> openStyles = new ArrayDeque<>();
        private final Deque<ListState> listStack = new ArrayDeque<>();

        int position() {
            return builder.position();
        }

        void append(String s) {
            builder.append(s);
        }

        void addStyle(int start, int end, Style style, String value) {
            builder.addStyle(start, end, style, value);
        }

        void addLink(int start, int end, String href) {
            builder.addLink(start, end, href);
        }

        void addMention(String name) {
            builder.addMention(name);
        }

        void openStyle(Style style) {
            openStyles.push(new OpenStyle(style, builder.position()));
        }

        void closeStyle(Style style) {
            Iterator<OpenStyle> it = openStyles.iterator();
            while (it.hasNext()) {
                OpenStyle os = it.next();
                if (os.style == style) {
                    builder.addStyle(os.start, builder.position(), style, null);
                    it.remove();
                    return;
                }
            }
        }

        void appendParagraphSeparator() {
            if (!listStack.isEmpty()) {
                builder.append("\n");
                return;
            }
            builder.append("\n\n");
        }

        void pushList(boolean ordered) {
            listStack.push(new ListState(ordered));
        }

        void popList() {
            if (!listStack.isEmpty())
                listStack.pop();
        }

        int listDepth() {
            return listStack.size();
        }

        void appendListPrefix() {
            if (listStack.isEmpty())
                return;
            ListState top = listStack.peek();
            top.index++;
            String indent = "  ".repeat(Math.max(0, listStack.size() - 1));
            String prefix = top.ordered ? (top.index + ". ") : "• ";
            builder.append(indent + prefix);
        }

        MessageMarkup build() {
            while (!openStyles.isEmpty()) {
                OpenStyle os = openStyles.pop();
                builder.addStyle(os.start, builder.position(), os.style, null);
            }
            MessageMarkup raw = builder.build();

            String trimmed = raw.text().stripTrailing();
            int finalLen = trimmed.length();
            for (var span : raw.styles()) {
                if (span.style() == Style.CODE_BLOCK && span.end() > finalLen) {
                    finalLen = span.end();
                }
            }
            if (finalLen >= raw.text().length()) {
                return raw;
            }

            List<StyleSpan> clampedStyles = new ArrayList<>();
            for (var s : raw.styles()) {
                int cs = Math.min(s.start(), finalLen);
                int ce = Math.min(s.end(), finalLen);
                if (ce > cs)
                    clampedStyles.add(new StyleSpan(cs, ce, s.style(), s.value()));
            }
            List<MessageMarkup.LinkSpan> clampedLinks = new ArrayList<>();
            for (var l : raw.links()) {
                int ls = Math.min(l.start(), finalLen);
                int le = Math.min(l.end(), finalLen);
                if (le > ls)
                    clampedLinks.add(new MessageMarkup.LinkSpan(ls, le, l.href()));
            }
            return new MessageMarkup(raw.text().substring(0, finalLen), clampedStyles, clampedLinks,
                    raw.mentions());
        }
    }

    private record OpenStyle(Style style, int start) {
    }

    private static class ListState {
        final boolean ordered;
        int index;

        ListState(boolean ordered) {
            this.ordered = ordered;
        }
    }
}
