package org.searchclient.serialization;

import com.fasterxml.jackson.databind.Module;

/**
 * Decides how typed values map to wire field names and shapes.
 *
 * The serializer only ever installs the module it is handed; what the module does is up to the resolver.
 */
public interface ContractResolver {

    /**
     * @return the Jackson module that applies this resolver's mapping rules to an ObjectMapper
     */
    Module asModule();
}
