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
package com.tomaszrup.phpls.document;

import java.util.List;

import com.tomaszrup.phpls.parser.Node;
import com.tomaszrup.phpls.parser.Phrase;

/**
 * Depth-first callbacks driven by {@link ParsedDocument#traverse(TreeVisitor)}.
 *
 * <p>{@code spine} holds the ancestors of {@code node}, root first; it is
 * empty for the root. The list is a read-only live view and must not be
 * retained past the callback.</p>
 */
public interface TreeVisitor {

	default VisitResult preorder(Node node, List<Phrase> spine) {
		return VisitResult.CONTINUE;
	}

	default VisitResult postorder(Node node, List<Phrase> spine) {
		return VisitResult.CONTINUE;
	}
}
