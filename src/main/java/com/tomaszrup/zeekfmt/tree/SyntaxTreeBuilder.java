////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.zeekfmt.tree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;

/**
 * Builds {@link SyntaxTree} arenas.
 *
 * <p>Parser adapters create {@link Element}s with explicit byte spans via
 * {@link #element(String, boolean, boolean, int, int, List)} and hand the root
 * to {@link #build(byte[], Element)}. Tests and tooling can instead create an
 * instance for a source string and let it locate each token's span, in order,
 * via {@link #token(String)}, {@link #leaf(String, String)} and friends:</p>
 *
 * <pre>{@code
 * SyntaxTreeBuilder b = new SyntaxTreeBuilder("module Foo;\n");
 * SyntaxTree tree = b.build(b.node("source_file",
 *         b.node("module_decl", b.token("module"), b.leaf("id", "Foo"), b.token(";")),
 *         b.nl()));
 * }</pre>
 *
 * <p>While building, comments that trail a composite construct on the same
 * source line are moved to directly after that construct's last token, so
 * they get written before the construct's own line break.</p>
 */
public final class SyntaxTreeBuilder {
	private final String sourceText;
	private final byte[] sourceBytes;
	private final int[] byteOffsets;
	private int cursor;

	/**
	 * Mutable node description consumed by {@link #build(byte[], Element)}.
	 */
	public static final class Element {
		private final String kind;
		private final boolean named;
		private final boolean extra;
		private final int startByte;
		private final int endByte;
		private final List<Element> children;

		Element(String kind, boolean named, boolean extra, int startByte, int endByte, List<Element> children) {
			this.kind = kind;
			this.named = named;
			this.extra = extra;
			this.startByte = startByte;
			this.endByte = endByte;
			this.children = new ArrayList<>(children);
		}

		public String getKind() {
			return kind;
		}

		public boolean isNamed() {
			return named;
		}

		public boolean isExtra() {
			return extra;
		}

		public int getStartByte() {
			return startByte;
		}

		public int getEndByte() {
			return endByte;
		}

		public List<Element> getChildren() {
			return Collections.unmodifiableList(children);
		}

		private boolean isComment() {
			return extra && named && kind.endsWith("_comment");
		}

		private boolean isNewline() {
			return extra && named && SyntaxNode.NEWLINE_KIND.equals(kind);
		}

		private boolean isBackwardDocComment() {
			return extra && named && SyntaxNode.BACKWARD_DOC_COMMENT_KIND.equals(kind);
		}

		private boolean hasGrammarChildren() {
			for (Element child : children) {
				if (!child.extra) {
					return true;
				}
			}
			return false;
		}

		private Element lastGrammarChild() {
			for (int i = children.size() - 1; i >= 0; i--) {
				if (!children.get(i).extra) {
					return children.get(i);
				}
			}
			return null;
		}
	}

	public SyntaxTreeBuilder(String sourceText) {
		this.sourceText = sourceText;
		this.sourceBytes = sourceText.getBytes(StandardCharsets.UTF_8);
		this.byteOffsets = new int[sourceText.length() + 1];
		int offset = 0;
		for (int i = 0; i < sourceText.length(); i++) {
			byteOffsets[i] = offset;
			char c = sourceText.charAt(i);
			if (Character.isHighSurrogate(c)) {
				offset += 4;
				byteOffsets[++i] = offset;
				continue;
			}
			offset += String.valueOf(c).getBytes(StandardCharsets.UTF_8).length;
		}
		byteOffsets[sourceText.length()] = offset;
	}

	// --- Locating factories ---

	/** An anonymous token whose kind is its literal text. */
	public Element token(String text) {
		return locate(text, text, false, false);
	}

	/** A named node without children, e.g. an identifier or constant. */
	public Element leaf(String kind, String text) {
		return locate(kind, text, true, false);
	}

	/** A blank-line marker for the next newline in the source. */
	public Element nl() {
		return locate(SyntaxNode.NEWLINE_KIND, "\n", true, true);
	}

	/** A comment extra of the given kind, e.g. {@code minor_comment}. */
	public Element comment(String kind, String text) {
		return locate(kind, text, true, true);
	}

	/** A named node spanning its children. */
	public Element node(String kind, Element... children) {
		List<Element> list = Arrays.asList(children);
		if (list.isEmpty()) {
			int at = byteOffsets[cursor];
			return new Element(kind, true, false, at, at, list);
		}
		return new Element(kind, true, false, list.get(0).startByte, list.get(list.size() - 1).endByte, list);
	}

	public SyntaxTree build(Element root) {
		return build(sourceBytes, root);
	}

	private Element locate(String kind, String text, boolean named, boolean extra) {
		int at = sourceText.indexOf(text, cursor);
		if (at < 0) {
			throw new IllegalArgumentException("'" + text + "' not found in source after offset " + cursor);
		}
		cursor = at + text.length();
		return new Element(kind, named, extra, byteOffsets[at], byteOffsets[cursor], Collections.emptyList());
	}

	// --- Span-based construction ---

	public static Element element(String kind, boolean named, boolean extra, int startByte, int endByte,
			List<Element> children) {
		return new Element(kind, named, extra, startByte, endByte, children);
	}

	/**
	 * Validates the element hierarchy against the source, attaches extras and
	 * flattens everything into an arena. The root ends up at index 0.
	 *
	 * <p>Extras between two grammar children precede the later one, except
	 * for a comment on the earlier child's line, which follows that child.</p>
	 */
	public static SyntaxTree build(byte[] source, Element root) {
		validate(source, root);
		hoistTrailingComments(source, root);

		List<Element> order = new ArrayList<>();
		collect(root, order);
		int size = order.size();

		String[] kinds = new String[size];
		boolean[] named = new boolean[size];
		boolean[] extra = new boolean[size];
		int[] starts = new int[size];
		int[] ends = new int[size];
		int[] parents = new int[size];
		int[][] children = new int[size][];
		int[][] cstChildren = new int[size][];
		int[] cstPositions = new int[size];
		int[][] prevExtras = new int[size][];
		int[][] nextExtras = new int[size][];
		Arrays.fill(parents, SyntaxTree.NO_NODE);
		Arrays.fill(prevExtras, new int[0]);
		Arrays.fill(nextExtras, new int[0]);

		IdentityHashMap<Element, Integer> indices = new IdentityHashMap<>();
		for (int i = 0; i < size; i++) {
			indices.put(order.get(i), i);
		}

		for (int i = 0; i < size; i++) {
			Element element = order.get(i);
			kinds[i] = element.kind;
			named[i] = element.named;
			extra[i] = element.extra;
			starts[i] = element.startByte;
			ends[i] = element.endByte;

			int[] cst = new int[element.children.size()];
			List<Integer> grammar = new ArrayList<>();
			List<Integer> trailingExtras = new ArrayList<>();
			List<Integer> pendingExtras = new ArrayList<>();
			int lastGrammar = SyntaxTree.NO_NODE;
			for (int pos = 0; pos < cst.length; pos++) {
				Element current = element.children.get(pos);
				int child = indices.get(current);
				cst[pos] = child;
				parents[child] = i;
				cstPositions[child] = pos;
				if (!current.extra) {
					if (lastGrammar != SyntaxTree.NO_NODE) {
						nextExtras[lastGrammar] = toArray(trailingExtras);
					}
					trailingExtras.clear();
					grammar.add(child);
					prevExtras[child] = toArray(pendingExtras);
					pendingExtras.clear();
					lastGrammar = child;
				} else if (lastGrammar != SyntaxTree.NO_NODE && pendingExtras.isEmpty()
						&& staysOnLine(source, element.children, pos, trailingExtras.size())) {
					trailingExtras.add(child);
				} else {
					pendingExtras.add(child);
				}
			}
			if (lastGrammar != SyntaxTree.NO_NODE) {
				trailingExtras.addAll(pendingExtras);
				nextExtras[lastGrammar] = toArray(trailingExtras);
			}
			cstChildren[i] = cst;
			children[i] = toArray(grammar);
		}

		return new SyntaxTree(source.clone(), kinds, named, extra, starts, ends, parents, children, cstChildren,
				cstPositions, prevExtras, nextExtras);
	}

	private static void validate(byte[] source, Element element) {
		if (element.kind == null || element.kind.isEmpty()) {
			throw new IllegalArgumentException("Node without kind at byte " + element.startByte);
		}
		if (element.startByte < 0 || element.endByte < element.startByte || element.endByte > source.length) {
			throw new IllegalArgumentException("Span [" + element.startByte + ", " + element.endByte
					+ ") of '" + element.kind + "' lies outside the source (" + source.length + " bytes)");
		}
		int previousEnd = element.startByte;
		for (Element child : element.children) {
			if (child.startByte < previousEnd) {
				throw new IllegalArgumentException("Child '" + child.kind + "' at byte " + child.startByte
						+ " of '" + element.kind + "' overlaps or precedes its previous sibling");
			}
			validate(source, child);
			previousEnd = child.endByte;
		}
	}

	private static void hoistTrailingComments(byte[] source, Element element) {
		List<Element> list = element.children;
		for (int pos = 1; pos < list.size(); pos++) {
			Element comment = list.get(pos);
			Element previous = list.get(pos - 1);
			if (!comment.isComment() || previous.extra || !previous.hasGrammarChildren()
					|| containsNewline(source, previous.endByte, comment.startByte)) {
				continue;
			}
			int runEnd = pos + 1;
			if (comment.isBackwardDocComment()) {
				while (runEnd + 1 < list.size() && list.get(runEnd).isNewline()
						&& list.get(runEnd + 1).isBackwardDocComment()) {
					runEnd += 2;
				}
			}
			List<Element> run = new ArrayList<>(list.subList(pos, runEnd));
			list.subList(pos, runEnd).clear();

			Element container = previous;
			Element last = container.lastGrammarChild();
			while (last.hasGrammarChildren()) {
				container = last;
				last = container.lastGrammarChild();
			}
			int insertAt = indexOfIdentity(container.children, last) + 1;
			container.children.addAll(insertAt, run);
			pos--;
		}
		for (Element child : list) {
			hoistTrailingComments(source, child);
		}
	}

	/**
	 * Whether the extra at {@code pos} belongs after the preceding grammar
	 * child rather than before the following one: a comment on that child's
	 * line, or the continuation of a backward-reference comment run started
	 * there. {@code trailing} counts the extras already kept with the child.
	 */
	private static boolean staysOnLine(byte[] source, List<Element> siblings, int pos, int trailing) {
		Element extra = siblings.get(pos);
		if (trailing == 0) {
			Element previous = siblings.get(pos - 1);
			return extra.isComment() && !containsNewline(source, previous.endByte, extra.startByte);
		}
		if (!siblings.get(pos - trailing).isBackwardDocComment()) {
			return false;
		}
		if (extra.isNewline()) {
			return pos + 1 < siblings.size() && siblings.get(pos + 1).isBackwardDocComment();
		}
		return extra.isBackwardDocComment() && siblings.get(pos - 1).isNewline();
	}

	private static boolean containsNewline(byte[] source, int from, int to) {
		for (int i = from; i < to && i < source.length; i++) {
			if (source[i] == '\n') {
				return true;
			}
		}
		return false;
	}

	private static int indexOfIdentity(List<Element> list, Element target) {
		for (int i = 0; i < list.size(); i++) {
			if (list.get(i) == target) {
				return i;
			}
		}
		return list.size() - 1;
	}

	private static void collect(Element element, List<Element> order) {
		order.add(element);
		for (Element child : element.children) {
			collect(child, order);
		}
	}

	private static int[] toArray(List<Integer> values) {
		int[] result = new int[values.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = values.get(i);
		}
		return result;
	}
}
