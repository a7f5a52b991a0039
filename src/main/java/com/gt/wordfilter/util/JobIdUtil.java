package com.gt.wordfilter.util;

import java.util.UUID;

// Job ids only need to be unique among the jobs one instance keeps in memory.
public class JobIdUtil {

    private static final int JOB_ID_LENGTH = 18;       // 8 bytes total, e.g. xxxxxxxx-xxxx-xxxx

    private JobIdUtil() { }

    public static String newJobId() {
        return UUID.randomUUID().toString().substring(0, JOB_ID_LENGTH);
    }
}
