package tacheck.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line after a line break with the current indentation. Used to
 * render diagnostics whose context tags nest the issue text underneath them.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean atLineStart = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write(System.lineSeparator());
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String lf = System.lineSeparator();
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			if (atLineStart) {
				for (int i = 0; i < indent; ++i) {
					out.write(' ');
				}
				atLineStart = false;
			}
			int next = data.indexOf(lf, start);
			if (next == -1) {
				out.write(data, start, data.length() - start);
				return;
			}
			int end = next + lf.length();
			out.write(data, start, end - start);
			start = end;
			atLineStart = true;
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
