/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.jsondoc;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arakelian.jsondoc.ParseError.Kind;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;

/**
 * <p>
 * Recursive-descent JSON reader that builds a {@link JsonValue} tree from a {@link JsonStream}.
 * </p>
 * <p>
 * The root must be an object or an array, and only whitespace may follow it. Strings are taken
 * as-is: a backslash inside a string is reported as {@link Kind#UNSUPPORTED_ESCAPE}. A number is
 * scanned as a run of digits, '.', 'e', 'E', '-' and '+'; it is a real if the run contains a '.' and
 * a natural otherwise.
 * </p>
 */
public final class JsonReader {
	public static class JsonParseException extends IOException {
		private final ParseError error;

		public JsonParseException(final ParseError error) {
			super(error.getMessage() + ": position=" + error.getOffset());
			this.error = error;
		}

		public ParseError getError() {
			return error;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonReader.class);

	private static final char[] TRUE_CHARS = new char[] { 't', 'r', 'u', 'e' };

	private static final char[] FALSE_CHARS = new char[] { 'f', 'a', 'l', 's', 'e' };

	private static final char[] NULL_CHARS = new char[] { 'n', 'u', 'l', 'l' };

	private static boolean isNumberChar(final char ch) {
		return ch >= '0' && ch <= '9' || ch == '.' || ch == 'e' || ch == 'E' || ch == '-' || ch == '+';
	}

	/**
	 * Parses JSON text into the given root value.
	 *
	 * @param json
	 *            JSON text
	 * @param root
	 *            receives the parsed document; left unchanged if parsing fails
	 * @return true if the text was parsed
	 */
	public static boolean parse(final CharSequence json, final JsonValue root) {
		return new JsonReader(new StringStream(json)).parse(root);
	}

	/**
	 * Parses a JSON file into the given root value. The whole file is read into memory first.
	 *
	 * @param path
	 *            file to be read, UTF-8 encoded
	 * @param root
	 *            receives the parsed document; left unchanged if reading or parsing fails
	 * @return true if the file was read and parsed
	 */
	public static boolean parseFile(final Path path, final JsonValue root) {
		return parseFile(path, Encoding.UTF8, root);
	}

	/**
	 * Parses a JSON file into the given root value. The whole file is read into memory first.
	 *
	 * @param path
	 *            file to be read
	 * @param encoding
	 *            encoding of the file
	 * @param root
	 *            receives the parsed document; left unchanged if reading or parsing fails
	 * @return true if the file was read and parsed
	 */
	public static boolean parseFile(final Path path, final Encoding encoding, final JsonValue root) {
		Preconditions.checkArgument(path != null, "path must be non-null");
		Preconditions.checkArgument(encoding != null, "encoding must be non-null");
		final String json;
		try {
			json = Files.asCharSource(path.toFile(), encoding.getCharset()).read();
		} catch (final IOException e) {
			LOGGER.warn("Unable to read JSON file {}", path, e);
			return false;
		}
		return parse(json, root);
	}

	/**
	 * Parses JSON text held in a mutable buffer, decoding strings into the buffer itself. The
	 * buffer contents are undefined afterwards.
	 *
	 * @param json
	 *            buffer holding JSON text
	 * @param root
	 *            receives the parsed document; left unchanged if parsing fails
	 * @return true if the text was parsed
	 */
	public static boolean parseInPlace(final char[] json, final JsonValue root) {
		final JsonReaderOptions options = ImmutableJsonReaderOptions.builder() //
				.inPlace(true) //
				.build();
		return new JsonReader(new InPlaceStringStream(json), options).parse(root);
	}

	/**
	 * Parses JSON text.
	 *
	 * @param json
	 *            JSON text
	 * @return root of the parsed document
	 * @throws JsonParseException
	 *             if the text is not well-formed
	 */
	public static JsonValue readValue(final CharSequence json) throws JsonParseException {
		return new JsonReader(new StringStream(json)).read();
	}

	/** input **/
	private final JsonStream stream;

	private final JsonReaderOptions options;

	/** current nesting of objects and arrays **/
	private int depth;

	/** error from the last call to {@link #parse(JsonValue)} **/
	private ParseError lastError;

	public JsonReader(final JsonStream stream) {
		this(stream, JsonReaderOptions.DEFAULT);
	}

	public JsonReader(final JsonStream stream, final JsonReaderOptions options) {
		Preconditions.checkArgument(stream != null, "stream must be non-null");
		Preconditions.checkArgument(options != null, "options must be non-null");
		this.stream = stream;
		this.options = options;
	}

	private JsonParseException createParseException(final Kind kind, final String msg) {
		return createParseException(kind, msg, stream.tell());
	}

	private JsonParseException createParseException(final Kind kind, final String msg, final int offset) {
		final ParseError error = ImmutableParseError.builder() //
				.kind(kind) //
				.message(msg) //
				.offset(offset) //
				.build();
		return new JsonParseException(error);
	}

	private void enter() throws JsonParseException {
		if (++depth > options.getMaxDepth()) {
			throw createParseException(
					Kind.DEPTH_EXCEEDED,
					"Nesting is deeper than the maximum of " + options.getMaxDepth());
		}
	}

	private void expect(final char expected, final Kind kind, final String msg) throws JsonParseException {
		if (stream.peek() != expected) {
			throw createParseException(kind, msg);
		}
		stream.take();
	}

	/**
	 * Returns the error from the last call to {@link #parse(JsonValue)}, if it failed.
	 *
	 * @return the error from the last call to {@link #parse(JsonValue)}
	 */
	public Optional<ParseError> getLastError() {
		return Optional.ofNullable(lastError);
	}

	public JsonReaderOptions getOptions() {
		return options;
	}

	/**
	 * Parses the stream into the given root value. Parse errors are logged and reported by
	 * {@link #getLastError()}.
	 *
	 * @param root
	 *            receives the parsed document; left unchanged if parsing fails
	 * @return true if the stream was parsed
	 */
	public boolean parse(final JsonValue root) {
		Preconditions.checkArgument(root != null, "root must be non-null");
		try {
			final JsonValue value = read();
			root.moveFrom(value);
			lastError = null;
			return true;
		} catch (final JsonParseException e) {
			lastError = e.getError();
			LOGGER.warn("Unable to parse JSON: {}", lastError);
			return false;
		}
	}

	private JsonValue parseArray() throws JsonParseException {
		enter();
		stream.take(); // skip '['
		final JsonValue array = new JsonValue(ValueType.ARRAY);
		skipWhitespace();

		if (stream.peek() == ']') {
			stream.take();
			depth--;
			return array;
		}

		for (;;) {
			array.add(parseValue());
			skipWhitespace();

			switch (stream.peek()) {
			case ',':
				stream.take();
				skipWhitespace();
				break;
			case ']':
				stream.take();
				depth--;
				return array;
			default:
				throw createParseException(
						Kind.MISSING_ARRAY_SEPARATOR,
						"Must be a comma or ']' after an array element");
			}
		}
	}

	private JsonValue parseLiteral(final char[] chars, final ValueType type) throws JsonParseException {
		stream.take(); // first char already matched
		for (int i = 1; i < chars.length; i++) {
			if (stream.peek() != chars[i]) {
				throw createParseException(Kind.INVALID_VALUE, "Invalid value, expected " + new String(chars));
			}
			stream.take();
		}
		return new JsonValue(type);
	}

	private JsonValue parseNumber() throws JsonParseException {
		// scan ahead on a copy, the number is only consumed once it converts
		final JsonStream scan = stream.snapshot();
		while (isNumberChar(scan.peek())) {
			scan.take();
		}

		final int start = stream.tell();
		if (scan.tell() == start) {
			throw createParseException(Kind.INVALID_VALUE, "Invalid value");
		}

		final String number = stream.span(start, scan.tell()).toString();
		final JsonValue value;
		try {
			if (number.indexOf('.') == -1) {
				value = new JsonValue(Long.parseLong(number));
			} else {
				final double real = Double.parseDouble(number);
				if (Double.isInfinite(real)) {
					throw createParseException(Kind.INVALID_NUMBER, "Number out of range: " + number);
				}
				value = new JsonValue(real);
			}
		} catch (final NumberFormatException e) {
			throw createParseException(Kind.INVALID_NUMBER, "Invalid number: " + number);
		}

		stream.commit(scan);
		return value;
	}

	private JsonValue parseObject() throws JsonParseException {
		enter();
		stream.take(); // skip '{'
		final JsonValue object = new JsonValue(ValueType.OBJECT);
		skipWhitespace();

		if (stream.peek() == '}') {
			stream.take();
			depth--;
			return object;
		}

		for (;;) {
			if (stream.peek() != '"') {
				throw createParseException(Kind.INVALID_MEMBER_NAME, "Name of an object member must be a string");
			}
			final JsonValue name = parseString();
			skipWhitespace();

			expect(':', Kind.MISSING_COLON, "There must be a colon after the name of an object member");
			skipWhitespace();

			// duplicate names replace the earlier value
			object.put(name, parseValue());
			skipWhitespace();

			switch (stream.peek()) {
			case ',':
				stream.take();
				skipWhitespace();
				break;
			case '}':
				stream.take();
				depth--;
				return object;
			default:
				throw createParseException(
						Kind.MISSING_OBJECT_SEPARATOR,
						"Must be a comma or '}' after an object member");
			}
		}
	}

	private JsonValue parseString() throws JsonParseException {
		stream.take(); // skip '"'
		if (options.isInPlace()) {
			return parseStringInPlace();
		}

		final JsonStream scan = stream.snapshot();
		for (;;) {
			switch (scan.peek()) {
			case '"':
				final JsonValue value = new JsonValue(stream.span(stream.tell(), scan.tell()));
				scan.take();
				stream.commit(scan);
				return value;
			case JsonStream.EOF:
				throw createParseException(
						Kind.UNTERMINATED_STRING,
						"Missing closing quotation mark in string",
						scan.tell());
			case '\\':
				throw createParseException(
						Kind.UNSUPPORTED_ESCAPE,
						"Escape sequences in strings are not supported",
						scan.tell());
			default:
				scan.take();
			}
		}
	}

	private JsonValue parseStringInPlace() throws JsonParseException {
		final int begin = stream.begin();
		for (;;) {
			switch (stream.peek()) {
			case '"':
				final int length = stream.end(begin);
				stream.take();
				return new JsonValue(stream.span(begin, begin + length));
			case JsonStream.EOF:
				throw createParseException(Kind.UNTERMINATED_STRING, "Missing closing quotation mark in string");
			case '\\':
				throw createParseException(Kind.UNSUPPORTED_ESCAPE, "Escape sequences in strings are not supported");
			default:
				stream.put(stream.take());
			}
		}
	}

	private JsonValue parseValue() throws JsonParseException {
		skipWhitespace();
		switch (stream.peek()) {
		case 'n':
			return parseLiteral(NULL_CHARS, ValueType.NULL);
		case 't':
			return parseLiteral(TRUE_CHARS, ValueType.TRUE);
		case 'f':
			return parseLiteral(FALSE_CHARS, ValueType.FALSE);
		case '"':
			return parseString();
		case '{':
			return parseObject();
		case '[':
			return parseArray();
		default:
			return parseNumber();
		}
	}

	/**
	 * Reads the whole stream as a single JSON document.
	 *
	 * @return root of the document, an object or an array
	 * @throws JsonParseException
	 *             if the stream does not hold well-formed JSON
	 */
	public JsonValue read() throws JsonParseException {
		depth = 0;
		skipWhitespace();

		final JsonValue root;
		switch (stream.peek()) {
		case '{':
			root = parseObject();
			break;
		case '[':
			root = parseArray();
			break;
		case JsonStream.EOF:
			throw createParseException(Kind.EMPTY_INPUT, "Input is empty");
		default:
			throw createParseException(Kind.INVALID_ROOT, "Root must be an object or an array");
		}

		skipWhitespace();
		if (stream.peek() != JsonStream.EOF) {
			throw createParseException(Kind.CONTENT_AFTER_ROOT, "Unexpected content after root");
		}
		return root;
	}

	private void skipWhitespace() {
		for (;;) {
			final char ch = stream.peek();
			if (ch != ' ' && ch != '\t' && ch != '\r' && ch != '\n') {
				return;
			}
			stream.take();
		}
	}

	@Override
	public String toString() {
		return "stream=" + stream + ",depth=" + depth;
	}
}
