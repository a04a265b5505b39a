package io.gridmesh.rpc;

import io.gridmesh.result.Result;

@FunctionalInterface
public interface RpcHandler {
    Result<?> handle(RpcRequest request, CallContext context) throws Exception;
}
