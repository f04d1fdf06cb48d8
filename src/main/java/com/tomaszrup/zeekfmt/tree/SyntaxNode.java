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

import java.util.List;
import java.util.function.Predicate;

/**
 * Read-only view of one node in a {@link SyntaxTree}.
 *
 * <p>Views are cheap value objects: two views are equal when they refer to
 * the same index of the same tree. Navigation methods return {@code null}
 * when the requested node does not exist.</p>
 */
public final class SyntaxNode {
	public static final String NEWLINE_KIND = "nl";
	public static final String BACKWARD_DOC_COMMENT_KIND = "zeekygen_prev_comment";
	private static final String COMMENT_SUFFIX = "_comment";

	private final SyntaxTree tree;
	private final int index;

	SyntaxNode(SyntaxTree tree, int index) {
		this.tree = tree;
		this.index = index;
	}

	public SyntaxTree tree() {
		return tree;
	}

	/** Arena index of this node, usable as a side-table key. */
	public int index() {
		return index;
	}

	/** Grammar symbol name for named nodes, literal token text for anonymous ones. */
	public String kind() {
		return tree.kind(index);
	}

	public boolean isNamed() {
		return tree.isNamed(index);
	}

	public boolean isExtra() {
		return tree.isExtra(index);
	}

	/**
	 * The kind if this is a named node, otherwise {@code null}.
	 */
	public String name() {
		return isNamed() ? kind() : null;
	}

	/**
	 * The kind if this is an anonymous token node, otherwise {@code null}.
	 */
	public String token() {
		return isNamed() ? null : kind();
	}

	public int startByte() {
		return tree.startByte(index);
	}

	public int endByte() {
		return tree.endByte(index);
	}

	/** Source text covered by this node's byte span. */
	public String text() {
		return tree.text(index);
	}

	public SyntaxNode parent() {
		int parent = tree.parent(index);
		return parent == SyntaxTree.NO_NODE ? null : new SyntaxNode(tree, parent);
	}

	// --- Grammar-significant children ---

	public List<SyntaxNode> children() {
		return tree.views(tree.childIndices(index));
	}

	public int childCount() {
		return tree.childCount(index);
	}

	public boolean hasChildren() {
		return tree.childCount(index) > 0;
	}

	/**
	 * Returns the grammar child at the given position, or {@code null}.
	 */
	public SyntaxNode child(int position) {
		int child = tree.child(index, position);
		return child == SyntaxTree.NO_NODE ? null : new SyntaxNode(tree, child);
	}

	// --- Extras and the full (concrete) child list ---

	/** Comments and blank-line markers directly preceding this node, in source order. */
	public List<SyntaxNode> prevExtras() {
		return tree.views(tree.prevExtraIndices(index));
	}

	/** Comments and blank-line markers directly following this node, in source order. */
	public List<SyntaxNode> nextExtras() {
		return tree.views(tree.nextExtraIndices(index));
	}

	/** All children, grammar-significant and extra, in source order. */
	public List<SyntaxNode> cstChildren() {
		return tree.views(tree.cstChildIndices(index));
	}

	public SyntaxNode prevCstSibling() {
		return cstSibling(-1);
	}

	public SyntaxNode nextCstSibling() {
		return cstSibling(1);
	}

	/**
	 * Walks backwards over the concrete siblings of this node and returns the
	 * first one satisfying the predicate, or {@code null}.
	 */
	public SyntaxNode findPrevCstSibling(Predicate<SyntaxNode> predicate) {
		SyntaxNode sibling = prevCstSibling();
		while (sibling != null) {
			if (predicate.test(sibling)) {
				return sibling;
			}
			sibling = sibling.prevCstSibling();
		}
		return null;
	}

	private SyntaxNode cstSibling(int delta) {
		int parent = tree.parent(index);
		if (parent == SyntaxTree.NO_NODE) {
			return null;
		}
		int sibling = tree.cstChild(parent, tree.cstPosition(index) + delta);
		return sibling == SyntaxTree.NO_NODE ? null : new SyntaxNode(tree, sibling);
	}

	// --- Predicates ---

	/** Whether this node is a blank-line marker. */
	public boolean isNewline() {
		return isNamed() && NEWLINE_KIND.equals(kind());
	}

	public boolean isComment() {
		return isNamed() && kind().endsWith(COMMENT_SUFFIX);
	}

	/** Whether this is a documentation comment referring to the preceding item ({@code ##<}). */
	public boolean isBackwardDocComment() {
		return isNamed() && BACKWARD_DOC_COMMENT_KIND.equals(kind());
	}

	/**
	 * Returns true if the predicate holds for this node or for a node on its
	 * leading edge, i.e. its first grammar child, that child's first child,
	 * and so on.
	 */
	public boolean hasProperty(Predicate<SyntaxNode> predicate) {
		SyntaxNode node = this;
		while (node != null) {
			if (predicate.test(node)) {
				return true;
			}
			node = node.child(0);
		}
		return false;
	}

	/**
	 * Depth-first search over all grammar descendants (excluding this node).
	 */
	public boolean anyDescendant(Predicate<SyntaxNode> predicate) {
		for (int child : tree.childIndices(index)) {
			SyntaxNode node = new SyntaxNode(tree, child);
			if (predicate.test(node) || node.anyDescendant(predicate)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Token text of the first grammar child, or {@code null} if the first
	 * child is missing or named.
	 */
	public String firstChildToken() {
		SyntaxNode first = child(0);
		return first != null ? first.token() : null;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof SyntaxNode)) {
			return false;
		}
		SyntaxNode other = (SyntaxNode) obj;
		return tree == other.tree && index == other.index;
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(tree) + index;
	}

	@Override
	public String toString() {
		return (isNamed() ? kind() : "'" + kind() + "'") + "[" + startByte() + ".." + endByte() + "]";
	}
}
