package io.gridmesh.authz;

public enum Combinator {
    ANY,
    ALL
}
