package ddx.tree;

/** The five label columns a tree can be trained to predict. */
public enum TargetField {
  CLINICIAN ("clinician",  "Clinician"),
  GPT4_0    ("gpt4_0",     "GPT4.0"),
  LLAMA     ("llama",      "LLAMA"),
  GEMINI    ("gemini",     "GEMINI"),
  DDX_SNOMED("ddx_snomed", "DDX SNOMED");

  final String _name;
  final String _header;

  TargetField(String name, String header) { _name = name; _header = header; }

  public String colName() { return _name;   }
  public String header()  { return _header; }

  public static TargetField byName(String s) {
    for( TargetField t : values() )
      if( t._name.equals(s) || t._header.equals(s) ) return t;
    return null;
  }

  @Override public String toString() { return _name; }
}
