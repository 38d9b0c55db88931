package secops.threatgraph.error.exception;

import secops.threatgraph.error.CommonErrorCode;
import secops.threatgraph.error.exception.base.ServerBaseException;

public class EventCodecException extends ServerBaseException {

  public EventCodecException(String detail, Throwable cause) {
    super(CommonErrorCode.EVENT_CODEC_ERROR, cause, detail);
  }
}
