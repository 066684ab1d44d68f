////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import java.util.Arrays;
import java.util.Comparator;

import org.eclipse.lsp4j.Position;

/**
 * Conversions between character offsets and LSP positions. Line breaks are
 * {@code \r\n}, {@code \r} or {@code \n}, as in the LSP specification.
 */
public class Positions {
	private Positions() {
	}

	public static final Comparator<Position> COMPARATOR = (Position p1, Position p2) -> {
		if (p1.getLine() != p2.getLine()) {
			return p1.getLine() - p2.getLine();
		}
		return p1.getCharacter() - p2.getCharacter();
	};

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/**
	 * Offsets at which each line of {@code text} starts. The first entry is
	 * always 0; a trailing line break opens a final empty line.
	 */
	public static int[] lineStartOffsets(String text) {
		int[] starts = new int[16];
		int count = 1;
		int length = text.length();
		int i = 0;
		while (i < length) {
			char c = text.charAt(i);
			++i;
			if (c == '\r') {
				if (i < length && text.charAt(i) == '\n') {
					++i;
				}
			} else if (c != '\n') {
				continue;
			}
			if (count == starts.length) {
				starts = Arrays.copyOf(starts, count * 2);
			}
			starts[count++] = i;
		}
		return Arrays.copyOf(starts, count);
	}

	/**
	 * Position of {@code offset}, clamped to {@code [0, text.length()]}.
	 */
	public static Position positionAt(String text, int[] lineStarts, int offset) {
		int clamped = Math.max(0, Math.min(offset, text.length()));
		int line = Arrays.binarySearch(lineStarts, clamped);
		if (line < 0) {
			line = -line - 2;
		}
		return new Position(line, clamped - lineStarts[line]);
	}

	/**
	 * Offset of {@code position}. Lines past the end clamp to the end of the
	 * text; characters past the end of a line clamp to the line end, before
	 * its line break.
	 */
	public static int offsetAt(String text, int[] lineStarts, Position position) {
		if (position.getLine() >= lineStarts.length) {
			return text.length();
		}
		if (position.getLine() < 0) {
			return 0;
		}
		int lineStart = lineStarts[position.getLine()];
		int lineEnd = findLineEndOffset(text, lineStart);
		int character = Math.max(0, position.getCharacter());
		return Math.min(lineStart + character, lineEnd);
	}

	/**
	 * Strict variant of {@link #offsetAt}: returns -1 when the position does
	 * not exist in {@code string}.
	 */
	public static int getOffset(String string, Position position) {
		if (string == null || position == null || !valid(position)) {
			return -1;
		}
		int[] lineStarts = lineStartOffsets(string);
		if (position.getLine() >= lineStarts.length) {
			return -1;
		}
		int lineStartOffset = lineStarts[position.getLine()];
		int lineLength = findLineEndOffset(string, lineStartOffset) - lineStartOffset;
		if (position.getCharacter() > lineLength) {
			return -1;
		}
		return lineStartOffset + position.getCharacter();
	}

	private static int findLineEndOffset(String string, int lineStartOffset) {
		for (int i = lineStartOffset; i < string.length(); i++) {
			char c = string.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
		}
		return string.length();
	}
}
