package ddx.parser;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.io.Closeables;

import ddx.Log;
import ddx.tree.Record;
import ddx.tree.TargetField;

/**
 * Reads records from a comma separated file with a header row.
 *
 * Columns are matched by their header (or the snake-case attribute/target
 * name); unknown columns are ignored. Fields are trimmed and an empty field is
 * an absent value. Rows may be shorter or longer than the header. A row whose
 * quoting is never closed is skipped with a warning.
 */
public class RecordParser {
  public static final String MASTER_INDEX = "Master_Index";

  private RecordParser() { }

  public static List<Record> parse(File f) throws IOException {
    Reader r = new BufferedReader(new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8));
    try {
      return parse(r, f.getPath());
    } finally {
      Closeables.closeQuietly(r);
    }
  }

  /** Parses all records; 'source' names the input in messages. Fails if not a
   * single valid record is found. */
  public static List<Record> parse(Reader in, String source) throws IOException {
    Rows rows = new Rows(in);
    List<String> header = rows.next();
    while( header != null && rows.blank(header) ) header = rows.next();
    if( header == null || rows._malformed )
      throw new IOException("No valid records in " + source);
    // byte order mark of spreadsheet exports
    if( header.get(0).startsWith("\uFEFF") ) header.set(0, header.get(0).substring(1).trim());

    List<Record> res = new ArrayList<Record>();
    List<String> row;
    while( (row = rows.next()) != null ) {
      if( rows._malformed ) {
        Log.warn("skipped malformed row in " + source + ": unterminated quote starting at line " + rows._rowLine);
        continue;
      }
      if( rows.blank(row) ) continue;
      Record rec = toRecord(header, row);
      if( !rec.has(TargetField.CLINICIAN) && !rec.has(TargetField.GPT4_0) )
        Log.warn("'" + source + "' record missing both Clinician & GPT4.0 targets (line " + rows._rowLine + ")");
      res.add(rec);
    }
    if( res.isEmpty() ) throw new IOException("No valid records in " + source);
    return res;
  }

  static Record toRecord(List<String> header, List<String> row) {
    Record.Builder b = Record.builder();
    int n = Math.min(header.size(), row.size());
    for( int i = 0; i < n; i++ ) {
      String v = row.get(i);
      if( v.isEmpty() ) continue;
      String col = header.get(i);
      if( col.equals(MASTER_INDEX) || col.equalsIgnoreCase("master_index") ) b.masterIndex(v);
      else b.set(col, v);
    }
    return b.build();
  }

  /** Splits the input into rows of trimmed fields. Double quotes start an
   * escaped field in which separators and line breaks are literal and "" is
   * a quote. */
  static final class Rows {
    final PushbackReader _in;
    int _line = 1;              // current line of the input
    int _rowLine;               // line the last row started on
    boolean _malformed;         // last row ended inside quotes

    Rows(Reader in) { _in = new PushbackReader(in, 1); }

    boolean blank(List<String> row) { return row.size() == 1 && row.get(0).isEmpty(); }

    /** Next row, or null at the end of the input. */
    List<String> next() throws IOException {
      _malformed = false;
      _rowLine = _line;
      List<String> fields = new ArrayList<String>();
      StringBuilder sb = new StringBuilder();
      boolean escaped = false, any = false;
      int c;
      while( (c = _in.read()) != -1 ) {
        any = true;
        if( escaped ) {
          if( c == '"' ) {
            int d = _in.read();
            if( d == '"' ) sb.append('"');
            else { escaped = false; if( d != -1 ) _in.unread(d); }
          } else {
            if( c == '\n' ) _line++;
            sb.append((char) c);
          }
          continue;
        }
        switch( c ) {
        case '"':
          if( sb.toString().trim().isEmpty() ) { sb.setLength(0); escaped = true; }
          else sb.append('"');
          break;
        case ',':
          fields.add(sb.toString().trim());
          sb.setLength(0);
          break;
        case '\r':
          int d = _in.read();
          if( d != '\n' && d != -1 ) _in.unread(d);
          // fall through
        case '\n':
          _line++;
          fields.add(sb.toString().trim());
          return fields;
        default:
          sb.append((char) c);
        }
      }
      if( !any ) return null;
      _malformed = escaped;
      fields.add(sb.toString().trim());
      return fields;
    }
  }
}
