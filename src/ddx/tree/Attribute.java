package ddx.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/** Categorical attributes a tree may split on. */
public enum Attribute {
  COUNTY          ("county",           "County"),
  HEALTH_LEVEL    ("health_level",     "Health level"),
  YEARS_EXPERIENCE("years_experience", "Years of Experience"),
  CLINICAL_PANEL  ("clinical_panel",   "Clinical Panel");

  final String _name;           // snake-case name
  final String _header;         // column header in the input CSV

  Attribute(String name, String header) { _name = name; _header = header; }

  public String colName() { return _name;   }
  public String header()  { return _header; }

  private static final List<Attribute> SORTED;
  static {
    List<Attribute> l = new ArrayList<Attribute>(Arrays.asList(values()));
    Collections.sort(l, new Comparator<Attribute>() {
      @Override public int compare(Attribute a, Attribute b) { return a._name.compareTo(b._name); }
    });
    SORTED = Collections.unmodifiableList(l);
  }

  /** All attributes in lexicographic name order. Gain ratio ties are resolved
   * in this order. */
  public static List<Attribute> sorted() { return SORTED; }

  /** Looks up an attribute by its snake-case name or its CSV header, null if
   * there is no such attribute. */
  public static Attribute byName(String s) {
    for( Attribute a : values() )
      if( a._name.equals(s) || a._header.equals(s) ) return a;
    return null;
  }

  @Override public String toString() { return _name; }
}
