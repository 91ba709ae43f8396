package com.locationscout.core.discovery;

import java.net.URI;
import java.util.Optional;

/** sitemap.xml / robots.txt 같은 텍스트 자원을 받아오는 계약 */
public interface TextFetcher {
    final class Response {
        public final int status;                // HTTP status (0 이면 네트워크 오류 같은 비정상)
        public final String body;               // 본문(실패 시 "")
        public final URI finalUri;              // 리다이렉트 후 최종 URI (없으면 요청 URI)
        public final Optional<String> error;    // 오류 메시지

        public Response(int status, String body, URI finalUri, String error) {
            this.status = status;
            this.body = body == null ? "" : body;
            this.finalUri = finalUri;
            this.error = Optional.ofNullable(error);
        }
        public static Response ok(int status, String body, URI finalUri) {
            return new Response(status, body, finalUri, null);
        }
        public static Response fail(String msg, URI finalUri) {
            return new Response(0, "", finalUri, msg);
        }
        public boolean isOk() {
            return error.isEmpty() && status == 200;
        }
    }

    /** 실패해도 예외 대신 Response.fail 로 돌려준다. */
    Response fetch(URI uri);
}
