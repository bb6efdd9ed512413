package org.rocstreaming.bindgen.util;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.rocstreaming.bindgen.generator.GeneratedFile;

import javax.tools.JavaFileObject;
import java.util.Arrays;

import static com.google.testing.compile.Compiler.javac;

/**
 * Compiles generated Java files in memory.
 */
public final class CompileHelper {

    private CompileHelper() {
    }

    public static Compilation compile(GeneratedFile... files) {
        return javac().compile(Arrays.stream(files)
                .map(CompileHelper::toSource)
                .toArray(JavaFileObject[]::new));
    }

    /**
     * Converts a generated file to a compiler source, named after its path below the source root.
     */
    public static JavaFileObject toSource(GeneratedFile file) {
        String path = file.relativePath();
        String qualified = path.substring(path.indexOf("org/"), path.length() - ".java".length())
                .replace('/', '.');
        return JavaFileObjects.forSourceString(qualified, file.content());
    }
}
