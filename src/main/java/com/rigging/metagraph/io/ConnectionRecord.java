package com.rigging.metagraph.io;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** An incoming connection, written as {@code [destinationPath, sourceNodeName, sourcePath]}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({ "destinationPath", "sourceNodeName", "sourcePath" })
public final class ConnectionRecord {
    private String destinationPath;
    private String sourceNodeName;
    private String sourcePath;
}
