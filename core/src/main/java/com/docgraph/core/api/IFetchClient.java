package com.docgraph.core.api;

import com.docgraph.core.model.PageRequest;
import com.docgraph.core.model.PageResult;

/**
 * 페이지 fetch 최소 계약(외부 협력자 경계).
 * - outboundLinks는 절대 URL로 해석해서 돌려준다.
 * - 요청당 타임아웃은 구현체가 책임진다.
 * - 네트워크/파싱 실패는 가능하면 succeeded=false 결과로 알린다.
 */
public interface IFetchClient extends AutoCloseable {
    PageResult fetch(PageRequest request);
    @Override default void close() throws Exception {}
}
