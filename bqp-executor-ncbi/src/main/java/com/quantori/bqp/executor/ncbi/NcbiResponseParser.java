package com.quantori.bqp.executor.ncbi;

import com.quantori.bqp.api.model.RemoteJobStatus;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/** Extracts the job id and status markers from NCBI response pages. */
@UtilityClass
class NcbiResponseParser {
  private static final Pattern REQUEST_ID = Pattern.compile("RID = ([A-Z0-9]+)");
  private static final Pattern ESTIMATED_SECONDS = Pattern.compile("RTOE = (\\d+)");
  private static final Pattern STATUS = Pattern.compile("Status=(WAITING|FAILED|UNKNOWN|READY)");

  static Optional<String> requestId(String submitResponse) {
    Matcher matcher = REQUEST_ID.matcher(StringUtils.defaultString(submitResponse));
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  static Integer estimatedSeconds(String submitResponse) {
    Matcher matcher = ESTIMATED_SECONDS.matcher(StringUtils.defaultString(submitResponse));
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }

  /**
   * A page without any marker, like a transient error or maintenance page, is reported as {@link
   * RemoteJobStatus#WAITING} so the job is polled again.
   */
  static RemoteJobStatus status(String pollResponse) {
    Matcher matcher = STATUS.matcher(StringUtils.defaultString(pollResponse));
    return matcher.find() ? RemoteJobStatus.valueOf(matcher.group(1)) : RemoteJobStatus.WAITING;
  }
}
