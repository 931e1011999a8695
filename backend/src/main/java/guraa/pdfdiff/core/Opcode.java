package guraa.pdfdiff.core;

import guraa.pdfdiff.model.DiffTag;
import guraa.pdfdiff.model.RangeOperation;
import lombok.Value;

/**
 * Edit-script step produced by {@link SequenceMatcher#getOpcodes()}.
 */
@Value
public class Opcode implements RangeOperation {
    DiffTag tag;
    int aStart;
    int aEnd;
    int bStart;
    int bEnd;
}
