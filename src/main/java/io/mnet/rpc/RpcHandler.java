package io.mnet.rpc;

import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.List;

/**
 * Function bound to a declared call name. The returned values are sent back only for
 * synchronous calls; null means no results.
 */
@FunctionalInterface
public interface RpcHandler {
    List<?> call(String host, ArrayNode arguments) throws Exception;
}
