package io.mnet.model;

public record SequenceKey(StreamKey stream, long sequence) {
    @Override
    public String toString() {
        return stream + "," + sequence;
    }
}
