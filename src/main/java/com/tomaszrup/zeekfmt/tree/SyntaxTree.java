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
import java.util.Collections;
import java.util.List;

/**
 * Index-addressed arena holding every node of one parsed script.
 *
 * <p>Nodes are stored in parallel arrays and referenced by their index. The
 * arena distinguishes the grammar-significant ("AST") children of a node from
 * its full child list, which additionally contains the grammar's "extra"
 * nodes: comments and blank-line markers. Each grammar child records the
 * extras adjacent to it, so that a formatter visiting the child can reproduce
 * them in source order.</p>
 *
 * <p>Instances are immutable once built; use {@link SyntaxTreeBuilder} or
 * {@link SyntaxTreeJsonReader} to create them.</p>
 */
public final class SyntaxTree {
	static final int NO_NODE = -1;

	private final byte[] source;
	private final String[] kinds;
	private final boolean[] named;
	private final boolean[] extra;
	private final int[] startBytes;
	private final int[] endBytes;
	private final int[] parents;
	private final int[][] children;
	private final int[][] cstChildren;
	private final int[] cstPositions;
	private final int[][] prevExtras;
	private final int[][] nextExtras;

	SyntaxTree(byte[] source, String[] kinds, boolean[] named, boolean[] extra, int[] startBytes,
			int[] endBytes, int[] parents, int[][] children, int[][] cstChildren, int[] cstPositions,
			int[][] prevExtras, int[][] nextExtras) {
		this.source = source;
		this.kinds = kinds;
		this.named = named;
		this.extra = extra;
		this.startBytes = startBytes;
		this.endBytes = endBytes;
		this.parents = parents;
		this.children = children;
		this.cstChildren = cstChildren;
		this.cstPositions = cstPositions;
		this.prevExtras = prevExtras;
		this.nextExtras = nextExtras;
	}

	/** The root node, always at index 0. */
	public SyntaxNode root() {
		return new SyntaxNode(this, 0);
	}

	public int size() {
		return kinds.length;
	}

	public SyntaxNode node(int index) {
		if (index < 0 || index >= kinds.length) {
			throw new IndexOutOfBoundsException("No node at index " + index + ", tree has " + kinds.length);
		}
		return new SyntaxNode(this, index);
	}

	/**
	 * Returns a copy of the source bytes this tree was parsed from.
	 */
	public byte[] source() {
		return source.clone();
	}

	// --- Accessors used by SyntaxNode ---

	String kind(int index) {
		return kinds[index];
	}

	boolean isNamed(int index) {
		return named[index];
	}

	boolean isExtra(int index) {
		return extra[index];
	}

	int startByte(int index) {
		return startBytes[index];
	}

	int endByte(int index) {
		return endBytes[index];
	}

	String text(int index) {
		return new String(source, startBytes[index], endBytes[index] - startBytes[index], StandardCharsets.UTF_8);
	}

	int parent(int index) {
		return parents[index];
	}

	int childCount(int index) {
		return children[index].length;
	}

	int child(int index, int position) {
		int[] list = children[index];
		if (position < 0 || position >= list.length) {
			return NO_NODE;
		}
		return list[position];
	}

	int cstChildCount(int index) {
		return cstChildren[index].length;
	}

	int cstChild(int index, int position) {
		int[] list = cstChildren[index];
		if (position < 0 || position >= list.length) {
			return NO_NODE;
		}
		return list[position];
	}

	int cstPosition(int index) {
		return cstPositions[index];
	}

	List<SyntaxNode> views(int[] indices) {
		if (indices.length == 0) {
			return Collections.emptyList();
		}
		List<SyntaxNode> result = new ArrayList<>(indices.length);
		for (int index : indices) {
			result.add(new SyntaxNode(this, index));
		}
		return Collections.unmodifiableList(result);
	}

	int[] childIndices(int index) {
		return children[index];
	}

	int[] cstChildIndices(int index) {
		return cstChildren[index];
	}

	int[] prevExtraIndices(int index) {
		return prevExtras[index];
	}

	int[] nextExtraIndices(int index) {
		return nextExtras[index];
	}
}
