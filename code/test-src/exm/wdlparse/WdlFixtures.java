package exm.wdlparse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Resources;

/**
 * Sample documents shared by tests, loaded from the test classpath
 */
public class WdlFixtures {

  /** Well-formed: struct, two tasks, workflow with scatter and if */
  public static final String PIPELINE = "wdl/pipeline.wdl";

  /** Type mismatch, unresolved name and an unterminated call block */
  public static final String BROKEN = "wdl/broken.wdl";

  public static String load(String name) {
    try {
      return Resources.toString(Resources.getResource(name),
                                StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Could not read " + name, e);
    }
  }
}
