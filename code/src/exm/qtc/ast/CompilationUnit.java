package exm.qtc.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All definitions registered from one source file.
 */
public class CompilationUnit {
  private final String file;
  private final List<StructDef> structs;
  private final List<FunctionDef> functions;

  public CompilationUnit(String file, List<StructDef> structs,
                         List<FunctionDef> functions) {
    this.file = file;
    this.structs = Collections.unmodifiableList(
                              new ArrayList<StructDef>(structs));
    this.functions = Collections.unmodifiableList(
                              new ArrayList<FunctionDef>(functions));
  }

  public static CompilationUnit of(String file, List<FunctionDef> functions) {
    return new CompilationUnit(file, Collections.<StructDef>emptyList(),
                               functions);
  }

  public String file() {
    return file;
  }

  public List<StructDef> structs() {
    return structs;
  }

  public List<FunctionDef> functions() {
    return functions;
  }
}
