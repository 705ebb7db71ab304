package io.rpcmeta.core.model;

/**
 * Position of a real parameter.
 *
 * @param index          index among all parameters of the method
 * @param indexOfGroup   index of the parameter group containing the parameter
 * @param indexInGroup   index within that parameter group
 * @param indexInMatched index among the parameters matched by the same schema
 *                       parameter
 */
public record ParamPosition(int index, int indexOfGroup, int indexInGroup, int indexInMatched) {

    public ParamPosition {
        if (index < 0 || indexOfGroup < 0 || indexInGroup < 0 || indexInMatched < 0) {
            throw new IllegalArgumentException("parameter position indices must not be negative");
        }
    }
}
