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
package com.tomaszrup.zeekfmt.formatters;

import java.util.HashMap;
import java.util.Map;

import com.tomaszrup.zeekfmt.output.HintSet;
import com.tomaszrup.zeekfmt.output.LineEngine;
import com.tomaszrup.zeekfmt.tree.SyntaxNode;
import com.tomaszrup.zeekfmt.tree.SyntaxTree;

/**
 * State shared by all node visits of one formatting pass: the tree, the
 * output engine, the rule registry, and a side table of output columns of
 * backward-reference documentation comments, keyed by node index.
 */
public final class FormattingSession {
	private final SyntaxTree tree;
	private final LineEngine engine;
	private final FormatterRegistry registry;
	private final Map<Integer, Integer> docCommentColumns = new HashMap<>();
	private int visitedNodes;

	public FormattingSession(SyntaxTree tree, LineEngine engine, FormatterRegistry registry) {
		this.tree = tree;
		this.engine = engine;
		this.registry = registry;
	}

	/** Formats the whole tree, starting at its root. */
	public void formatTree() {
		visit(tree.root(), 0, HintSet.NONE);
	}

	/**
	 * Formats one node with the rule its kind resolves to.
	 */
	public void visit(SyntaxNode node, int indent, HintSet hints) {
		Formatter formatter = registry.resolve(node);
		visitedNodes++;
		formatter.format(new FormatContext(this, node, indent, formatter.adjustHints(hints)));
	}

	/**
	 * Whether the given node is laid out by a rule of the given type.
	 */
	public boolean isFormattedBy(SyntaxNode node, Class<? extends Formatter> type) {
		return node != null && type.isInstance(registry.resolve(node));
	}

	public void recordDocCommentColumn(SyntaxNode comment, int column) {
		docCommentColumns.put(comment.index(), column);
	}

	/**
	 * Returns the column recorded for the given comment, or {@code null} if
	 * it hasn't been written yet.
	 */
	public Integer getDocCommentColumn(SyntaxNode comment) {
		return docCommentColumns.get(comment.index());
	}

	public SyntaxTree getTree() {
		return tree;
	}

	public LineEngine getEngine() {
		return engine;
	}

	public FormatterRegistry getRegistry() {
		return registry;
	}

	public int getVisitedNodes() {
		return visitedNodes;
	}
}
