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

/**
 * Outcome of a {@link TreeVisitor} callback, interpreted by
 * {@link ParsedDocument#traverse(TreeVisitor)}.
 */
public enum VisitResult {
	/** Descend into the node's children (pre-order) or keep walking (post-order). */
	CONTINUE,
	/** Do not visit the children; the node's post-order callback still runs. */
	SKIP_CHILDREN,
	/** End the traversal; no further callbacks are made. */
	STOP
}
