/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.tensile.print;

import java.util.List;
import java.util.Map;
import net.hydromatic.tensile.ast.Op;
import net.hydromatic.tensile.compile.Prop;
import org.apache.calcite.util.Pair;

/**
 * Writes documents as script text.
 *
 * <p>A call, tuple or list is written on one line if it fits within the line
 * width; otherwise it is written with one element per line, each followed by
 * a comma.
 */
public class DocWriter {
  static final DocWriter DEFAULT = new DocWriter(100, 4);

  private final int lineWidth;
  private final int indentSpaces;

  /**
   * Creates a DocWriter.
   *
   * @param lineWidth Maximum line length, or -1 for no limit
   * @param indentSpaces Number of spaces to indent broken elements
   */
  public DocWriter(int lineWidth, int indentSpaces) {
    this.lineWidth = lineWidth;
    this.indentSpaces = indentSpaces;
  }

  /** Creates a DocWriter from the {@link Prop#LINE_WIDTH} and
   * {@link Prop#INDENT_SPACES} properties. */
  public static DocWriter of(Map<Prop, Object> props) {
    return new DocWriter(
        Prop.LINE_WIDTH.intValue(props), Prop.INDENT_SPACES.intValue(props));
  }

  /** Writes a document to a string. */
  public String write(Doc doc) {
    return write(new StringBuilder(), doc).toString();
  }

  /** Writes a document to a buffer. */
  public StringBuilder write(StringBuilder buf, Doc doc) {
    return write1(buf, 0, doc, 0, 0);
  }

  /**
   * Writes a document. If the first attempt goes beyond the end of the line,
   * back-tracks and writes it again with its elements on separate lines.
   */
  private StringBuilder write1(
      StringBuilder buf, int indent, Doc doc, int left, int right) {
    final int start = buf.length();
    final int lineStart = buf.lastIndexOf("\n") + 1;
    flat(buf, doc, left, right);
    if (lineWidth >= 0 && buf.length() - lineStart > lineWidth) {
      buf.setLength(start);
      broken(buf, indent, doc, left, right);
    }
    return buf;
  }

  /** Writes a document on a single line. */
  private StringBuilder flat(StringBuilder buf, Doc doc, int left, int right) {
    if (doc instanceof Doc.LiteralDoc) {
      return literal(buf, ((Doc.LiteralDoc) doc).value, left);
    } else if (doc instanceof Doc.IdDoc) {
      return buf.append(((Doc.IdDoc) doc).name);
    } else if (doc instanceof Doc.AttrAccessDoc) {
      final Doc.AttrAccessDoc a = (Doc.AttrAccessDoc) doc;
      return flat(buf, a.value, 0, 0).append('.').append(a.name);
    } else if (doc instanceof Doc.CallDoc) {
      final Doc.CallDoc call = (Doc.CallDoc) doc;
      flat(buf, call.callee, 0, 0).append('(');
      int i = 0;
      for (Doc arg : call.args) {
        if (i++ > 0) {
          buf.append(", ");
        }
        flat(buf, arg, 0, 0);
      }
      for (Pair<String, Doc> kwarg : call.kwargs) {
        if (i++ > 0) {
          buf.append(", ");
        }
        flat(buf.append(kwarg.left).append('='), kwarg.right, 0, 0);
      }
      return buf.append(')');
    } else if (doc instanceof Doc.TupleDoc) {
      final List<Doc> elements = ((Doc.TupleDoc) doc).elements;
      buf.append('(');
      flatList(buf, elements);
      if (elements.size() == 1) {
        buf.append(',');
      }
      return buf.append(')');
    } else if (doc instanceof Doc.ListDoc) {
      return flatList(buf.append('['), ((Doc.ListDoc) doc).elements)
          .append(']');
    } else if (doc instanceof Doc.DictDoc) {
      buf.append('{');
      int i = 0;
      for (Pair<Doc, Doc> entry : ((Doc.DictDoc) doc).entries) {
        if (i++ > 0) {
          buf.append(", ");
        }
        flat(buf, entry.left, 0, 0).append(": ");
        flat(buf, entry.right, 0, 0);
      }
      return buf.append('}');
    } else if (doc instanceof Doc.OperationDoc) {
      return operation(buf, (Doc.OperationDoc) doc, left, right);
    } else {
      throw new AssertionError("unknown doc " + doc.getClass());
    }
  }

  private StringBuilder flatList(StringBuilder buf, List<Doc> elements) {
    int i = 0;
    for (Doc element : elements) {
      if (i++ > 0) {
        buf.append(", ");
      }
      flat(buf, element, 0, 0);
    }
    return buf;
  }

  private StringBuilder operation(
      StringBuilder buf, Doc.OperationDoc doc, int left, int right) {
    final Op op = doc.op;
    if (left > op.left || op.right < right) {
      buf.append('(');
      operation(buf, doc, 0, 0);
      return buf.append(')');
    }
    if (doc.operands.size() == 1) {
      return flat(buf.append(op.padded), doc.operands.get(0), op.right, right);
    }
    flat(buf, doc.operands.get(0), left, op.left);
    buf.append(op.padded);
    return flat(buf, doc.operands.get(1), op.right, right);
  }

  private static StringBuilder literal(
      StringBuilder buf, Object value, int left) {
    if (value == null) {
      return buf.append("None");
    } else if (value instanceof Boolean) {
      return buf.append((Boolean) value ? "True" : "False");
    } else if (value instanceof Long) {
      final long i = (Long) value;
      return i < 0 && left > 0
          ? buf.append('(').append(i).append(')')
          : buf.append(i);
    } else if (value instanceof Double) {
      return buf.append((double) (Double) value);
    } else {
      return string(buf, (String) value);
    }
  }

  /** Appends a string literal in double quotes. */
  static StringBuilder string(StringBuilder buf, String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"':
          buf.append("\\\"");
          break;
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\t':
          buf.append("\\t");
          break;
        default:
          buf.append(c);
      }
    }
    return buf.append('"');
  }

  /**
   * Writes a call, tuple or list with one element per line. Other documents
   * cannot be broken, and are written on one line.
   */
  private StringBuilder broken(
      StringBuilder buf, int indent, Doc doc, int left, int right) {
    final int indent2 = indent + indentSpaces;
    if (doc instanceof Doc.CallDoc) {
      final Doc.CallDoc call = (Doc.CallDoc) doc;
      flat(buf, call.callee, 0, 0).append("(\n");
      for (Doc arg : call.args) {
        indent(buf, indent2);
        write1(buf, indent2, arg, 0, 0).append(",\n");
      }
      for (Pair<String, Doc> kwarg : call.kwargs) {
        indent(buf, indent2).append(kwarg.left).append('=');
        write1(buf, indent2, kwarg.right, 0, 0).append(",\n");
      }
      return indent(buf, indent).append(')');
    } else if (doc instanceof Doc.TupleDoc) {
      return brokenList(
          buf.append("(\n"), indent, ((Doc.TupleDoc) doc).elements)
          .append(')');
    } else if (doc instanceof Doc.ListDoc) {
      return brokenList(
          buf.append("[\n"), indent, ((Doc.ListDoc) doc).elements)
          .append(']');
    } else {
      return flat(buf, doc, left, right);
    }
  }

  private StringBuilder brokenList(
      StringBuilder buf, int indent, List<Doc> elements) {
    final int indent2 = indent + indentSpaces;
    for (Doc element : elements) {
      indent(buf, indent2);
      write1(buf, indent2, element, 0, 0).append(",\n");
    }
    return indent(buf, indent);
  }

  private static StringBuilder indent(StringBuilder buf, int indent) {
    for (int i = 0; i < indent; i++) {
      buf.append(' ');
    }
    return buf;
  }
}

// End DocWriter.java
