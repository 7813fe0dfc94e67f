package com.semsort.files;

import java.nio.file.Path;

public record MoveRequest(Path source, Path destination) {
}
