package ddx;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Command line arguments of the form {@code -name=value}, {@code -name value}
 * or a bare {@code -flag}. Options are declared as the fields of an
 * {@link Opt} subclass, their initial values being the defaults, and filled
 * in by {@link #extract}.
 */
public class Arguments {

  /** Base class of option holders. Supported field types: String, int,
   * double and boolean (a bare flag sets it to true). */
  public static class Opt {
    @Override public String toString() {
      List<String> res = new ArrayList<String>();
      for( Field f : fields(getClass()) ) {
        try {
          res.add(f.getName() + "=" + f.get(this));
        } catch( IllegalAccessException e ) {
          throw new Error(e);
        }
      }
      return Joiner.on(' ').join(res);
    }
  }

  private final List<String[]> _pairs = new ArrayList<String[]>(); // name, value (null for flags)

  public Arguments(String[] args) {
    for( int i = 0; i < args.length; i++ ) {
      String a = args[i];
      if( !a.startsWith("-") ) throw new IllegalArgumentException("Unexpected argument '" + a + "'");
      String name = a.substring(a.startsWith("--") ? 2 : 1);
      String value = null;
      int eq = name.indexOf('=');
      if( eq >= 0 ) {
        value = name.substring(eq + 1);
        name = name.substring(0, eq);
      } else if( i + 1 < args.length && !args[i + 1].startsWith("-") ) {
        value = args[++i];
      }
      _pairs.add(new String[] { name, value });
    }
  }

  /** Sets the fields of the holder named by the arguments. Returns the number
   * of arguments used. Unknown options are rejected. */
  public int extract(Opt opt) {
    int count = 0;
    for( String[] p : _pairs ) {
      Field f = field(opt.getClass(), p[0]);
      if( f == null ) throw new IllegalArgumentException("Unknown option '-" + p[0] + "'");
      set(opt, f, p[1]);
      count++;
    }
    return count;
  }

  private static void set(Opt opt, Field f, String value) {
    Class<?> type = f.getType();
    try {
      if( type == boolean.class ) {
        f.setBoolean(opt, value == null || Boolean.parseBoolean(value));
        return;
      }
      if( value == null ) throw new IllegalArgumentException("Option '-" + f.getName() + "' needs a value");
      if( type == String.class )      f.set(opt, value);
      else if( type == int.class )    f.setInt(opt, Integer.parseInt(value.trim()));
      else if( type == double.class ) f.setDouble(opt, Double.parseDouble(value.trim()));
      else throw new Error("Unsupported option type " + type + " of " + f.getName());
    } catch( NumberFormatException e ) {
      throw new IllegalArgumentException("Bad value '" + value + "' for option '-" + f.getName() + "'", e);
    } catch( IllegalAccessException e ) {
      throw new Error(e);
    }
  }

  private static Field field(Class<?> c, String name) {
    for( Field f : fields(c) ) if( f.getName().equals(name) ) return f;
    return null;
  }

  static List<Field> fields(Class<?> c) {
    List<Field> res = new ArrayList<Field>();
    for( ; c != null && c != Opt.class; c = c.getSuperclass() ) {
      for( Field f : c.getDeclaredFields() ) {
        int m = f.getModifiers();
        if( Modifier.isStatic(m) || Modifier.isFinal(m) || f.isSynthetic() ) continue;
        f.setAccessible(true);
        res.add(f);
      }
    }
    return res;
  }
}
