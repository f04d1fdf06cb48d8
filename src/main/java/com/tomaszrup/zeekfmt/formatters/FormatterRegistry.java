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

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.zeekfmt.formatters.decls.AttrFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.EnumBodyFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.ExportDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.GlobalDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.InitFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.InitializerFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.ModuleDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.RedefEnumDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.RedefRecordDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.TypeDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.TypeFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.TypeSpecFormatter;
import com.tomaszrup.zeekfmt.formatters.expressions.ExprFormatter;
import com.tomaszrup.zeekfmt.formatters.expressions.ExprListFormatter;
import com.tomaszrup.zeekfmt.formatters.extras.MinorCommentFormatter;
import com.tomaszrup.zeekfmt.formatters.extras.NlFormatter;
import com.tomaszrup.zeekfmt.formatters.extras.ZeekygenCommentFormatter;
import com.tomaszrup.zeekfmt.formatters.extras.ZeekygenPrevCommentFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.CaptureListFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.EventHdrFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.FormalArgFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.FormalArgsFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.FuncBodyFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.FuncDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.FuncHdrFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.FuncHdrVariantFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.FuncParamsFormatter;
import com.tomaszrup.zeekfmt.formatters.statements.CaseListFormatter;
import com.tomaszrup.zeekfmt.formatters.statements.CaseTypeListFormatter;
import com.tomaszrup.zeekfmt.formatters.statements.StmtFormatter;
import com.tomaszrup.zeekfmt.tree.SyntaxNode;

/**
 * Maps node kinds onto layout rules.
 *
 * <p>Lookup order: explicit registrations by grammar symbol name, then the
 * {@link NodeKind} table (reached through the symbol naming convention),
 * then the generic {@link Formatter}. Anonymous token nodes always get the
 * generic rule. Lookups are memoized; unknown symbols are logged once.</p>
 */
public final class FormatterRegistry {
	private static final Logger logger = LoggerFactory.getLogger(FormatterRegistry.class);

	private final Formatter fallback = new Formatter();
	private final Map<String, Formatter> explicit = new ConcurrentHashMap<>();
	private final Map<NodeKind, Formatter> table = new EnumMap<>(NodeKind.class);
	private final Map<String, Formatter> resolved = new ConcurrentHashMap<>();
	private final Set<String> reportedUnknown = ConcurrentHashMap.newKeySet();

	/**
	 * Creates a registry holding every rule this formatter knows about.
	 */
	public static FormatterRegistry defaultRegistry() {
		FormatterRegistry registry = new FormatterRegistry();

		registry.register(NodeKind.MODULE_DECL, new ModuleDeclFormatter());
		registry.register(NodeKind.EXPORT_DECL, new ExportDeclFormatter());
		registry.register(NodeKind.TYPE_DECL, new TypeDeclFormatter());
		registry.register(NodeKind.REDEF_ENUM_DECL, new RedefEnumDeclFormatter());
		registry.register(NodeKind.REDEF_RECORD_DECL, new RedefRecordDeclFormatter());
		registry.register(NodeKind.TYPE, new TypeFormatter());
		registry.register(NodeKind.TYPE_SPEC, new TypeSpecFormatter());
		registry.register(NodeKind.ENUM_BODY, new EnumBodyFormatter());
		registry.register(NodeKind.INITIALIZER, new InitializerFormatter());
		registry.register(NodeKind.INIT, new InitFormatter());
		registry.register(NodeKind.ATTR, new AttrFormatter());

		GlobalDeclFormatter globalDecl = new GlobalDeclFormatter();
		registry.register(NodeKind.GLOBAL_DECL, globalDecl);
		registry.register(NodeKind.CONST_DECL, globalDecl);
		registry.register(NodeKind.OPTION_DECL, globalDecl);
		registry.register(NodeKind.REDEF_DECL, globalDecl);

		registry.register(NodeKind.FUNC_DECL, new FuncDeclFormatter());
		registry.register(NodeKind.FUNC_HDR, new FuncHdrFormatter());
		FuncHdrVariantFormatter variant = new FuncHdrVariantFormatter();
		registry.register(NodeKind.FUNC, variant);
		registry.register(NodeKind.HOOK, variant);
		registry.register(NodeKind.EVENT, variant);
		registry.register(NodeKind.FUNC_PARAMS, new FuncParamsFormatter());
		registry.register(NodeKind.FUNC_BODY, new FuncBodyFormatter());
		registry.register(NodeKind.FORMAL_ARGS, new FormalArgsFormatter());
		registry.register(NodeKind.FORMAL_ARG, new FormalArgFormatter());
		registry.register(NodeKind.CAPTURE_LIST, new CaptureListFormatter());
		registry.register(NodeKind.EVENT_HDR, new EventHdrFormatter());

		registry.register(NodeKind.STMT, new StmtFormatter());
		registry.register(NodeKind.CASE_LIST, new CaseListFormatter());
		registry.register(NodeKind.CASE_TYPE_LIST, new CaseTypeListFormatter());
		registry.register(NodeKind.EXPR_LIST, new ExprListFormatter());
		registry.register(NodeKind.EXPR, new ExprFormatter());

		SpaceSeparatedFormatter spaceSeparated = new SpaceSeparatedFormatter();
		registry.register(NodeKind.CAPTURE, spaceSeparated);
		registry.register(NodeKind.ATTR_LIST, spaceSeparated);
		registry.register(NodeKind.INTERVAL, spaceSeparated);

		registry.register(NodeKind.PREPROC_DIRECTIVE, new PreprocDirectiveFormatter());
		registry.register(NodeKind.NL, new NlFormatter());
		registry.register(NodeKind.MINOR_COMMENT, new MinorCommentFormatter());
		ZeekygenCommentFormatter docComment = new ZeekygenCommentFormatter();
		registry.register(NodeKind.ZEEKYGEN_HEAD_COMMENT, docComment);
		registry.register(NodeKind.ZEEKYGEN_NEXT_COMMENT, docComment);
		registry.register(NodeKind.ZEEKYGEN_PREV_COMMENT, new ZeekygenPrevCommentFormatter());
		registry.register(NodeKind.NULLNODE, new NullFormatter());
		return registry;
	}

	/**
	 * Registers a rule for a grammar symbol by name, taking precedence over
	 * the {@link NodeKind} table.
	 */
	public void register(String symbolName, Formatter formatter) {
		explicit.put(symbolName, formatter);
		resolved.clear();
	}

	public void register(NodeKind kind, Formatter formatter) {
		table.put(kind, formatter);
		resolved.clear();
	}

	public Formatter resolve(SyntaxNode node) {
		if (!node.isNamed()) {
			return fallback;
		}
		return resolve(node.kind());
	}

	/**
	 * Returns the rule for a grammar symbol name, or the generic rule if no
	 * specific one exists.
	 */
	public Formatter resolve(String symbolName) {
		return resolved.computeIfAbsent(symbolName, this::lookup);
	}

	public Formatter getFallback() {
		return fallback;
	}

	private Formatter lookup(String symbolName) {
		Formatter formatter = explicit.get(symbolName);
		if (formatter != null) {
			return formatter;
		}
		Optional<NodeKind> kind = NodeKind.fromGrammarName(symbolName);
		if (kind.isPresent() && table.containsKey(kind.get())) {
			return table.get(kind.get());
		}
		if (reportedUnknown.add(symbolName)) {
			logger.debug("No layout rule for '{}', using the generic one", symbolName);
		}
		return fallback;
	}
}
