package org.newo.nsl.metadata;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies the declared parameters of a template file.
 */
@FunctionalInterface
public interface IParameterSource {

    /**
     * Looks up the parameters declared for a template.
     * @param templateFile The path of the template file.
     * @return The declared parameters, or {@link DeclaredParameters#absent()} if the template has no metadata.
     * @throws IOException if metadata exists but cannot be read or parsed.
     */
    DeclaredParameters load(Path templateFile) throws IOException;
}
