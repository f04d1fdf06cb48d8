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
package com.tomaszrup.zeekfmt;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.zeekfmt.config.FormatterOptions;
import com.tomaszrup.zeekfmt.formatters.FormatterRegistry;
import com.tomaszrup.zeekfmt.formatters.FormattingSession;
import com.tomaszrup.zeekfmt.output.LineEngine;
import com.tomaszrup.zeekfmt.tree.SyntaxTree;

/**
 * Formats Zeek scripts given as parsed syntax trees.
 *
 * <p>Instances are immutable and may be shared; every call runs a fresh
 * session with its own output engine.</p>
 */
public class ScriptFormatter {
	private static final Logger logger = LoggerFactory.getLogger(ScriptFormatter.class);

	private final FormatterOptions options;
	private final FormatterRegistry registry;

	public ScriptFormatter() {
		this(FormatterOptions.defaults());
	}

	public ScriptFormatter(FormatterOptions options) {
		this(options, FormatterRegistry.defaultRegistry());
	}

	public ScriptFormatter(FormatterOptions options, FormatterRegistry registry) {
		this.options = options;
		this.registry = registry;
	}

	/**
	 * Writes the formatted script to the sink as UTF-8.
	 *
	 * @throws FormatterException if writing to the sink fails
	 */
	public void format(SyntaxTree tree, OutputStream sink) {
		long start = System.nanoTime();
		LineEngine engine = new LineEngine(sink, options);
		FormattingSession session = new FormattingSession(tree, engine, registry);
		session.formatTree();
		engine.finish();
		logger.debug("Formatted {} nodes into {} lines in {} ms", session.getVisitedNodes(),
				engine.getLinesWritten(), (System.nanoTime() - start) / 1_000_000);
	}

	public String format(SyntaxTree tree) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		format(tree, out);
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	public FormatterOptions getOptions() {
		return options;
	}
}
