package com.goormthonuniv.groundedchat.controller;

import com.goormthonuniv.groundedchat.dto.ChatReply;
import com.goormthonuniv.groundedchat.dto.InboundMessage;
import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.memory.ConversationStateManager;
import com.goormthonuniv.groundedchat.service.ChatPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ChatController {

    private final ChatPipeline pipeline;
    private final ConversationStateManager state;

    @Operation(summary = "채팅 메시지 처리", description = "수신 메시지를 처리해 검색 근거 기반 답변을 반환합니다. 그룹 채팅은 @핸들 멘션이 있어야 처리됩니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "처리 성공 (무시된 메시지는 ignored=true)"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류"),
            @ApiResponse(responseCode = "503", description = "대화 저장 실패"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping("/chat/messages")
    public ResponseEntity<ChatReply> receive(@Valid @RequestBody InboundMessage msg) {
        return ResponseEntity.ok(pipeline.handle(msg));
    }

    @Operation(summary = "채팅 프로필 조회")
    @GetMapping("/chats/{chatId}/profile")
    public ResponseEntity<Profile> profile(@PathVariable long chatId) {
        return ResponseEntity.ok(state.profile(chatId));
    }

    @Operation(summary = "채팅 프로필 삭제", description = "선호/요약 문서를 지웁니다. 대화 기록은 남습니다.")
    @DeleteMapping("/chats/{chatId}/profile")
    public ResponseEntity<Void> clearProfile(@PathVariable long chatId) {
        state.clearProfile(chatId);
        return ResponseEntity.noContent().build();
    }
}
