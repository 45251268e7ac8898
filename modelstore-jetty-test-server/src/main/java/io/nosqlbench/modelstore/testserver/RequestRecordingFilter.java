package io.nosqlbench.modelstore.testserver;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/// Servlet filter in front of the default servlet which records every request and applies
/// the faults registered on the owning fixture.
///
/// Two faults are supported: a forced status code for a path, and a one-shot interruption
/// that writes only a prefix of the body and then drops the connection.
class RequestRecordingFilter implements Filter {
    private static final Logger logger = LogManager.getLogger(RequestRecordingFilter.class);

    private final JettyFileServerFixture fixture;

    RequestRecordingFilter(JettyFileServerFixture fixture) {
        this.fixture = fixture;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
        throws IOException, ServletException
    {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        String path = httpRequest.getRequestURI();
        String range = httpRequest.getHeader("Range");
        fixture.record(new RecordedRequest(httpRequest.getMethod(), path, range));

        Integer forcedStatus = fixture.forcedStatusFor(path);
        if (forcedStatus != null) {
            logger.debug("forcing status {} for {}", forcedStatus, path);
            httpResponse.sendError(forcedStatus);
            return;
        }

        if ("GET".equals(httpRequest.getMethod())) {
            Long cutoff = fixture.takeInterruption(path);
            if (cutoff != null) {
                writeInterrupted(path, range, cutoff, httpResponse);
                return;
            }
        }
        chain.doFilter(request, response);
    }

    private void writeInterrupted(String path, String range, long cutoff, HttpServletResponse response)
        throws IOException
    {
        Path file = fixture.getRootDirectory().resolve(path.substring(1));
        if (!Files.isRegularFile(file)) {
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        long size = Files.size(file);
        long start = parseRangeStart(range);
        long length = size - start;

        if (start > 0) {
            response.setStatus(HttpServletResponse.SC_PARTIAL_CONTENT);
            response.setHeader("Content-Range", "bytes " + start + "-" + (size - 1) + "/" + size);
        } else {
            response.setStatus(HttpServletResponse.SC_OK);
        }
        response.setHeader("Accept-Ranges", "bytes");
        response.setContentType("application/octet-stream");
        response.setContentLengthLong(length);

        long toWrite = Math.min(cutoff, length);
        try (InputStream in = Files.newInputStream(file)) {
            in.skipNBytes(start);
            OutputStream out = response.getOutputStream();
            byte[] buffer = new byte[8192];
            long written = 0;
            while (written < toWrite) {
                int read = in.read(buffer, 0, (int) Math.min(buffer.length, toWrite - written));
                if (read < 0) {
                    break;
                }
                out.write(buffer, 0, read);
                written += read;
            }
            out.flush();
            response.flushBuffer();
        }
        logger.debug("interrupting {} after {} of {} bytes", path, toWrite, length);
        throw new IOException("Simulated connection drop after " + toWrite + " bytes of " + path);
    }

    private static long parseRangeStart(String range) {
        if (range == null || !range.startsWith("bytes=")) {
            return 0L;
        }
        String bounds = range.substring("bytes=".length());
        int dash = bounds.indexOf('-');
        if (dash <= 0) {
            return 0L;
        }
        return Long.parseLong(bounds.substring(0, dash).trim());
    }
}
