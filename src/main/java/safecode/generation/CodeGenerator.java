package safecode.generation;

import java.io.IOException;

/**
 * The external code-generation provider, reduced to one call.
 *
 * <p>Implementations own transport, authentication, retries and timeouts.
 */
public interface CodeGenerator {

    /**
     * Sends one prompt and returns the provider's full reply.
     *
     * @param prompt    complete prompt text
     * @param maxTokens upper bound on completion tokens
     * @throws IOException if the provider cannot be reached or rejects the request
     */
    GenerationResponse generate(String prompt, int maxTokens) throws IOException;
}
